package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalIndicators {
    private Double relativeStrengthIndex;
    private Double ma50;
    private Double ma200;
    private Double macdLine;
    private Double macdSignal;
}
