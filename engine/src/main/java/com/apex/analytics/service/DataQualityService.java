package com.apex.analytics.service;

import com.apex.analytics.model.DataPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores supporting data points on reliability, recency and source reputation.
 */
@Service
@RequiredArgsConstructor
public class DataQualityService {

    static final double EMPTY_SCORE = 30.0;
    private static final double DEFAULT_RELIABILITY = 0.5;
    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private static final List<String> HIGH_QUALITY_SOURCES = List.of("bloomberg", "reuters", "sec", "fed", "treasury");
    private static final List<String> MEDIUM_QUALITY_SOURCES = List.of("yahoo", "google", "marketwatch", "cnbc");

    private final Clock clock;

    /**
     * Average quality of the given points on a 0-100 scale; 30 when there are none.
     */
    public double assess(List<DataPoint> dataPoints) {
        List<DataPoint> points = dataPoints == null
                ? List.of()
                : dataPoints.stream().filter(Objects::nonNull).toList();
        if (points.isEmpty()) {
            return EMPTY_SCORE;
        }
        Instant now = clock.instant();
        double total = 0.0;
        for (DataPoint point : points) {
            double reliability = point.getReliability() != null ? point.getReliability() : DEFAULT_RELIABILITY;
            double score = reliability * 0.4 + recencyScore(point.getTimestamp(), now) * 0.3
                    + sourceQualityScore(point.getSource()) * 0.3;
            total += score * 100;
        }
        return total / points.size();
    }

    double recencyScore(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return 0.1;
        }
        double ageDays = Duration.between(timestamp, now).toMillis() / MILLIS_PER_DAY;
        if (ageDays <= 1) return 1.0;
        if (ageDays <= 7) return 0.9;
        if (ageDays <= 30) return 0.7;
        if (ageDays <= 90) return 0.5;
        if (ageDays <= 365) return 0.3;
        return 0.1;
    }

    double sourceQualityScore(String source) {
        if (source == null) {
            return 0.5;
        }
        String normalized = source.toLowerCase(Locale.ROOT);
        if (HIGH_QUALITY_SOURCES.stream().anyMatch(normalized::contains)) {
            return 0.9;
        }
        if (MEDIUM_QUALITY_SOURCES.stream().anyMatch(normalized::contains)) {
            return 0.7;
        }
        return 0.5;
    }
}
