package com.meshsentinel.core.features;

import com.meshsentinel.core.model.Sample;

import java.util.Arrays;
import java.util.Optional;

/**
 * Point in feature space, optionally tied to the sample that closed its
 * window.
 *
 * <p>
 * Vectors produced by {@link FeatureExtractor} always have
 * {@link FeatureExtractor#DIMENSIONS} components laid out as
 * {@code [mean, stddev, trend, volatility]}. The clustering engine itself
 * accepts any dimensionality as long as all inputs agree.
 * </p>
 */
public final class FeatureVector {

    public static final int MEAN = 0;
    public static final int STD_DEV = 1;
    public static final int TREND = 2;
    public static final int VOLATILITY = 3;

    private final double[] features;
    private final Sample trigger;

    private FeatureVector(double[] features, Sample trigger) {
        if (features.length == 0) {
            throw new IllegalArgumentException("A feature vector needs at least one component");
        }
        this.features = features.clone();
        this.trigger = trigger;
    }

    /**
     * @param trigger  sample that triggered the window; may be {@code null}
     * @param features feature components
     */
    public static FeatureVector of(Sample trigger, double... features) {
        return new FeatureVector(features, trigger);
    }

    public static FeatureVector of(double... features) {
        return new FeatureVector(features, null);
    }

    /**
     * @return a copy of the components
     */
    public double[] toArray() {
        return features.clone();
    }

    public double get(int dimension) {
        return features[dimension];
    }

    public int dimensions() {
        return features.length;
    }

    public Optional<Sample> getTrigger() {
        return Optional.ofNullable(trigger);
    }

    public double distanceTo(double[] point) {
        return Statistics.euclideanDistance(features, point);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return Arrays.equals(features, that.features);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(features);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(features);
    }
}
