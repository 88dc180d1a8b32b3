package com.meshsentinel.core.features;

import com.meshsentinel.core.model.Sample;

import java.util.List;
import java.util.Objects;

/**
 * Numeric helpers shared by feature extraction, clustering and detection.
 *
 * <p>
 * Every helper is total: degenerate inputs (empty arrays, zero denominators)
 * return a documented 0.0 or 1.0 fallback instead of NaN or infinity.
 * </p>
 */
public final class Statistics {

    private Statistics() {
        // utility class — not instantiable
    }

    /**
     * @return the sample values in order
     */
    public static double[] values(List<Sample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }

    /**
     * @return arithmetic mean, 0 for an empty array
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (denominator {@code n - 1}).
     *
     * @return the deviation, 0 when fewer than two values
     */
    public static double sampleStdDev(double[] values) {
        if (values.length <= 1) {
            return 0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    /**
     * Relative change from the first to the last value.
     *
     * @return {@code (last - first) / first}; 0 when fewer than two values or
     *         when the first value is 0
     */
    public static double trend(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double first = values[0];
        double last = values[values.length - 1];
        if (first == 0) {
            return 0;
        }
        return (last - first) / first;
    }

    /**
     * Sample standard deviation of the relative step changes
     * {@code (v[i] - v[i-1]) / v[i-1]}. A step whose previous value is 0
     * counts as a change of 0.
     *
     * @return the volatility, 0 when fewer than two steps exist
     */
    public static double volatility(double[] values) {
        if (values.length < 3) {
            return 0;
        }
        double[] changes = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            changes[i - 1] = previous != 0 ? (values[i] - previous) / previous : 0;
        }
        return sampleStdDev(changes);
    }

    /**
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static double euclideanDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * @return {@code numerator / denominator}, or 1.0 when the denominator is 0
     */
    public static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 1.0 : numerator / denominator;
    }
}
