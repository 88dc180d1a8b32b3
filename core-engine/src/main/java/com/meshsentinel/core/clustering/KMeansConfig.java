package com.meshsentinel.core.clustering;

/**
 * Immutable K-means parameters.
 *
 * @since 1.0.0
 */
public final class KMeansConfig {

    private final int k;
    private final int maxIterations;
    private final double tolerance;

    /**
     * @param k             number of clusters; must be &ge; 1
     * @param maxIterations iteration cap; must be &ge; 1
     * @param tolerance     centroid displacement under which a cluster is
     *                      considered stable; must be &ge; 0
     * @throws IllegalArgumentException if any value is out of range
     */
    public KMeansConfig(int k, int maxIterations, double tolerance) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, got: " + k);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got: " + maxIterations);
        }
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got: " + tolerance);
        }
        this.k = k;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public int getK() {
        return k;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return "KMeansConfig{k=" + k + ", maxIterations=" + maxIterations + ", tolerance=" + tolerance + '}';
    }
}
