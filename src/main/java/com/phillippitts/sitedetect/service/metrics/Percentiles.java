package com.phillippitts.sitedetect.service.metrics;

import java.util.Arrays;

/**
 * Percentiles by linear interpolation between closest ranks:
 * {@code k = (n - 1) * p}, {@code value = s[floor(k)] + (k - floor(k)) * (s[ceil(k)] - s[floor(k)])}.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sorted values in ascending order
     * @param p fraction in [0, 1]
     * @return the interpolated percentile, or 0 for an empty array
     */
    public static double of(double[] sorted, double p) {
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("p must be between 0.0 and 1.0, got: " + p);
        }
        if (sorted.length == 0) {
            return 0.0;
        }
        double k = (sorted.length - 1) * p;
        int f = (int) Math.floor(k);
        int c = (int) Math.ceil(k);
        if (f == c) {
            return sorted[f];
        }
        return sorted[f] + (k - f) * (sorted[c] - sorted[f]);
    }

    /** Sorts a copy of {@code values} and returns p50, p90, p95. */
    public static double[] p50p90p95(double[] values) {
        double[] s = Arrays.copyOf(values, values.length);
        Arrays.sort(s);
        return new double[] {of(s, 0.50), of(s, 0.90), of(s, 0.95)};
    }
}
