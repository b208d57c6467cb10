package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One daily bar of an investment's price history, oldest first in {@link Investment#getHistoricalPerformance()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBar {
    private LocalDate date;
    private double open;
    private double high;
    private double low;
    private double close;
    private double adjustedClose;
    private long volume;
}
