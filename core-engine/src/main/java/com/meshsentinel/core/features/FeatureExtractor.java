package com.meshsentinel.core.features;

import com.meshsentinel.core.model.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a run of samples into sliding-window feature vectors.
 *
 * <p>
 * For every index {@code i} from {@code windowSize} to {@code n - 1}, the
 * window {@code points[i - windowSize, i)} is summarized as
 * {@code [mean, stddev, trend, volatility]} and tagged with {@code points[i]},
 * the sample that follows the window. The result therefore holds
 * {@code max(0, n - windowSize)} vectors.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureExtractor {

    /** Dimensionality of every vector this extractor produces. */
    public static final int DIMENSIONS = 4;

    /**
     * @param points     samples in time order; must not be {@code null}
     * @param windowSize samples per window; must be &gt; 0
     * @return one feature vector per complete window followed by a trigger
     * @throws IllegalArgumentException if {@code windowSize <= 0}
     */
    public List<FeatureVector> extractFeatures(List<Sample> points, int windowSize) {
        Objects.requireNonNull(points, "points must not be null");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
        }
        if (points.size() <= windowSize) {
            return Collections.emptyList();
        }

        double[] values = Statistics.values(points);
        List<FeatureVector> features = new ArrayList<>(points.size() - windowSize);
        for (int i = windowSize; i < values.length; i++) {
            double[] window = new double[windowSize];
            System.arraycopy(values, i - windowSize, window, 0, windowSize);
            features.add(FeatureVector.of(points.get(i), summarize(window)));
        }
        return Collections.unmodifiableList(features);
    }

    /**
     * @return {@code [mean, stddev, trend, volatility]} of one window
     */
    static double[] summarize(double[] window) {
        double[] summary = new double[DIMENSIONS];
        summary[FeatureVector.MEAN] = Statistics.mean(window);
        summary[FeatureVector.STD_DEV] = Statistics.sampleStdDev(window);
        summary[FeatureVector.TREND] = Statistics.trend(window);
        summary[FeatureVector.VOLATILITY] = Statistics.volatility(window);
        return summary;
    }
}
