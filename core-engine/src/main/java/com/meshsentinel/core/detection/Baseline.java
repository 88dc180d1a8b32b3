package com.meshsentinel.core.detection;

import com.meshsentinel.core.clustering.Cluster;
import com.meshsentinel.core.features.FeatureVector;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Learned normal behaviour of one entity: the clusters of a single completed
 * K-means fit.
 *
 * <p>
 * Immutable. Relearning builds a new instance which replaces the old one in
 * {@link BaselineRegistry}; the two are never merged.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    /** Distance threshold used when the baseline holds no assigned points. */
    static final double FALLBACK_THRESHOLD = 1.0;

    private final String entity;
    private final List<Cluster> clusters;
    private final Instant learnedAt;
    private final int totalPoints;
    private final double pooledVariance;

    /**
     * @throws IllegalArgumentException if {@code clusters} is empty
     */
    public Baseline(String entity, List<Cluster> clusters, Instant learnedAt) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.learnedAt = Objects.requireNonNull(learnedAt, "learnedAt must not be null");
        Objects.requireNonNull(clusters, "clusters must not be null");
        if (clusters.isEmpty()) {
            throw new IllegalArgumentException("A baseline needs at least one cluster");
        }
        this.clusters = List.copyOf(clusters);

        int points = 0;
        double weightedVariance = 0;
        for (Cluster cluster : this.clusters) {
            points += cluster.size();
            weightedVariance += cluster.variance() * cluster.size();
        }
        this.totalPoints = points;
        this.pooledVariance = points == 0 ? 0 : weightedVariance / points;
    }

    public String getEntity() {
        return entity;
    }

    public List<Cluster> getClusters() {
        return clusters;
    }

    public Instant getLearnedAt() {
        return learnedAt;
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    /**
     * @return intra-cluster variances pooled across clusters, weighted by size
     */
    public double getPooledVariance() {
        return pooledVariance;
    }

    /**
     * @return distance from {@code vector} to the closest centroid
     */
    public double nearestDistance(FeatureVector vector) {
        double min = Double.POSITIVE_INFINITY;
        for (Cluster cluster : clusters) {
            min = Math.min(min, cluster.distanceTo(vector));
        }
        return min;
    }

    /**
     * Distance above which a vector no longer fits this baseline.
     *
     * @param sensitivityLevel multiplier on the pooled standard deviation
     * @return {@code sqrt(pooledVariance) * sensitivityLevel}, or
     *         {@value #FALLBACK_THRESHOLD} when no points were assigned
     */
    public double distanceThreshold(double sensitivityLevel) {
        if (totalPoints == 0) {
            return FALLBACK_THRESHOLD;
        }
        return Math.sqrt(pooledVariance) * sensitivityLevel;
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "entity='" + entity + '\'' +
                ", clusters=" + clusters.size() +
                ", points=" + totalPoints +
                ", learnedAt=" + learnedAt +
                '}';
    }
}
