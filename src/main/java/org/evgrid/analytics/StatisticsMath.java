package org.evgrid.analytics;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and moment helpers shared by the analytics views.
 */
@UtilityClass
final class StatisticsMath {

    /**
     * Half-up decimal rounding, matching SQL {@code ROUND(numeric, scale)}.
     * Non-finite values are returned unchanged.
     */
    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    static Double roundOrNull(Double value, int scale) {
        return value == null ? null : round(value, scale);
    }

    /**
     * {@code part / whole * 100}, or 0 when {@code whole} is zero.
     */
    static double percent(long part, long whole, int scale) {
        if (whole == 0) {
            return 0.0d;
        }
        return round(part * 100.0d / whole, scale);
    }

    static Double mean(double sum, long count) {
        return count == 0 ? null : sum / count;
    }

    /**
     * Sample variance via Welford accumulation; null for fewer than two values.
     */
    static Double sampleVariance(double[] values, int count) {
        if (count < 2) {
            return null;
        }
        double mean = 0.0d;
        double m2 = 0.0d;
        for (int i = 0; i < count; i++) {
            double delta = values[i] - mean;
            mean += delta / (i + 1);
            m2 += delta * (values[i] - mean);
        }
        return m2 / (count - 1);
    }

    static Double sqrtOrNull(Double value) {
        return value == null ? null : Math.sqrt(value);
    }
}
