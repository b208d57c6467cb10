package com.apex.analytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Tunable modelling assumptions, bound from {@code analytics.*}. Defaults match application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
@Validated
public class AnalyticsProperties {

    @Valid
    private Assumptions assumptions = new Assumptions();
    @Valid
    private Liquidity liquidity = new Liquidity();
    @Valid
    private MonteCarlo monteCarlo = new MonteCarlo();
    @Valid
    private Projection projection = new Projection();
    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Assumptions {
        private double riskFreeRate = 0.02;

        private double benchmarkReturn = 0.08;

        @DecimalMin("0.0")
        private double transactionCost = 0.01;

        @Min(1)
        private int tradingDaysPerYear = 252;

        @DecimalMin("0.001")
        @DecimalMax("0.5")
        private double varConfidenceLevel = 0.05;

        // Downside deviation approximated as a share of total volatility
        @Positive
        private double downsideDeviationFactor = 0.7;

        // Tracking error approximated as a share of total volatility
        @Positive
        private double trackingErrorFactor = 0.5;

        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double defaultCorrelation = 0.5;
    }

    @Data
    public static class Liquidity {
        @Positive
        private long minDailyVolume = 100_000L;

        @Min(1)
        private int volumeWindow = 30;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double highRiskFraction = 0.3;
    }

    @Data
    public static class MonteCarlo {
        @Min(100)
        private int iterations = 10_000;

        private double targetReturn = 0.10;

        // Unset means a fresh, unseeded generator per run
        private Long seed;
    }

    @Data
    public static class Projection {
        @Min(1)
        private int maxDays = 365;
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 3;

        @Min(1)
        private int maxPoolSize = 12;

        @Min(0)
        private int queueCapacity = 100;
    }
}
