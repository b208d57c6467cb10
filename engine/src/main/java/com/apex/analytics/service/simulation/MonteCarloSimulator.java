package com.apex.analytics.service.simulation;

import com.apex.analytics.dto.MonteCarloResults;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Normal-distribution return simulation. Samples are drawn with the Box-Muller transform
 * from the supplied generator, so a seeded generator reproduces a run exactly.
 */
@Component
public class MonteCarloSimulator {

    static final int[] PERCENTILES = {1, 5, 10, 25, 50, 75, 90, 95, 99};

    public MonteCarloResults simulate(double mean, double volatility, int iterations, double targetReturn,
                                      RandomGenerator random) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        double[] returns = new double[iterations];
        for (int i = 0; i < iterations; i++) {
            returns[i] = nextNormal(mean, volatility, random);
        }
        Arrays.sort(returns);

        double sum = 0.0;
        for (double r : returns) {
            sum += r;
        }
        double meanReturn = sum / iterations;

        double squared = 0.0;
        for (double r : returns) {
            squared += (r - meanReturn) * (r - meanReturn);
        }
        double standardDeviation = Math.sqrt(squared / iterations);

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int p : PERCENTILES) {
            percentiles.put(String.valueOf(p), returns[percentileIndex(iterations, p)]);
        }

        int losses = 0;
        int hits = 0;
        for (double r : returns) {
            if (r < 0) losses++;
            if (r >= targetReturn) hits++;
        }

        return new MonteCarloResults(
                iterations,
                meanReturn,
                standardDeviation,
                Collections.unmodifiableMap(percentiles),
                (double) losses / iterations,
                (double) hits / iterations,
                tailMean(returns, percentiles.get("5"))
        );
    }

    static int percentileIndex(int iterations, int percentile) {
        int index = (int) ((long) iterations * percentile / 100);
        return Math.min(index, iterations - 1);
    }

    /**
     * Mean of the sorted samples at or below {@code threshold}; never empty because the
     * threshold is itself a sample.
     */
    static double tailMean(double[] sorted, double threshold) {
        double sum = 0.0;
        int count = 0;
        for (double r : sorted) {
            if (r > threshold) {
                break;
            }
            sum += r;
            count++;
        }
        return count == 0 ? threshold : sum / count;
    }

    static double nextNormal(double mean, double stdDev, RandomGenerator random) {
        // u1 in (0, 1] keeps the logarithm finite
        double u1 = 1.0 - random.nextDouble();
        double u2 = random.nextDouble();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
        return mean + stdDev * z;
    }
}
