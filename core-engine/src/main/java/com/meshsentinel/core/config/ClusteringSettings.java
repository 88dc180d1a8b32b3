package com.meshsentinel.core.config;

import com.meshsentinel.core.clustering.KMeansConfig;

import java.util.List;

/**
 * K-means parameters as they appear in YAML.
 *
 * @since 1.0.0
 */
public class ClusteringSettings {

    private int k = 3;
    private int maxIterations = 100;
    private double tolerance = 0.01;

    void collectErrors(List<String> errors) {
        if (k < 1) {
            errors.add("clustering.k must be >= 1, got: " + k);
        }
        if (maxIterations < 1) {
            errors.add("clustering.maxIterations must be >= 1, got: " + maxIterations);
        }
        if (tolerance < 0) {
            errors.add("clustering.tolerance must be >= 0, got: " + tolerance);
        }
    }

    /**
     * @return immutable clusterer configuration
     * @throws IllegalArgumentException if any value is out of range
     */
    public KMeansConfig toKMeansConfig() {
        return new KMeansConfig(k, maxIterations, tolerance);
    }

    public int getK() {
        return k;
    }

    public void setK(int k) {
        this.k = k;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public String toString() {
        return "ClusteringSettings{k=" + k + ", maxIterations=" + maxIterations + ", tolerance=" + tolerance + '}';
    }
}
