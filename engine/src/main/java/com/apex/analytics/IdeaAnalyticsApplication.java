package com.apex.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdeaAnalyticsApplication {
	public static void main(String[] args) {
		SpringApplication.run(IdeaAnalyticsApplication.class, args);
	}
}
