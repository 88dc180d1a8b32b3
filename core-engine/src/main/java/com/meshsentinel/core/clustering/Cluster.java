package com.meshsentinel.core.clustering;

import com.meshsentinel.core.features.FeatureVector;
import com.meshsentinel.core.features.Statistics;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A frozen K-means cluster: its centroid and the vectors assigned to it by
 * the final assignment pass.
 *
 * @since 1.0.0
 */
public final class Cluster {

    private final double[] centroid;
    private final List<FeatureVector> points;

    /**
     * @param centroid cluster centre; copied
     * @param points   assigned vectors; copied
     * @throws IllegalArgumentException if a point's dimensionality differs from
     *                                  the centroid's
     */
    public Cluster(double[] centroid, List<FeatureVector> points) {
        Objects.requireNonNull(centroid, "centroid must not be null");
        Objects.requireNonNull(points, "points must not be null");
        for (FeatureVector point : points) {
            if (point.dimensions() != centroid.length) {
                throw new IllegalArgumentException("Point " + point + " does not match centroid dimensionality "
                        + centroid.length);
            }
        }
        this.centroid = centroid.clone();
        this.points = Collections.unmodifiableList(List.copyOf(points));
    }

    /**
     * @return a copy of the centroid
     */
    public double[] getCentroid() {
        return centroid.clone();
    }

    public int dimensions() {
        return centroid.length;
    }

    public List<FeatureVector> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double distanceTo(FeatureVector vector) {
        return vector.distanceTo(centroid);
    }

    /**
     * Intra-cluster variance: mean squared distance of the assigned points to
     * the centroid.
     *
     * @return the variance, 0 for an empty cluster
     */
    public double variance() {
        if (points.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (FeatureVector point : points) {
            double distance = Statistics.euclideanDistance(point.toArray(), centroid);
            sum += distance * distance;
        }
        return sum / points.size();
    }

    @Override
    public String toString() {
        return "Cluster{centroid=" + Arrays.toString(centroid) + ", size=" + points.size() + '}';
    }
}
