package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fundamentals {
    private Double peRatio;
    private Double profitMargin;
    private Double returnOnEquity;
    private Double debtToEquity;
}
