package com.meshsentinel.core.clustering;

import com.meshsentinel.core.features.FeatureVector;
import com.meshsentinel.core.features.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic K-means over {@link FeatureVector}s.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li><b>Seeding</b> — the input is split into K contiguous blocks by index
 * and centroid {@code i} starts at the vector at index {@code i * n / K}. No
 * randomness: identical input yields identical output.</li>
 * <li><b>Assignment</b> — each vector joins the centroid at minimum Euclidean
 * distance; ties go to the lowest cluster index.</li>
 * <li><b>Update</b> — each non-empty cluster moves its centroid to the
 * per-dimension mean of its members. A cluster that received no members keeps
 * its previous centroid.</li>
 * <li><b>Convergence</b> — stop once every centroid moved by at most the
 * configured tolerance, or after {@code maxIterations} passes.</li>
 * </ol>
 *
 * <p>
 * Fitting fewer vectors than K is not an error: {@link #fit(List)} returns an
 * empty list and the caller treats it as "no baseline available".
 * </p>
 *
 * <p>
 * Stateless apart from its configuration, hence thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class KMeansClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(KMeansClusterer.class);

    private final KMeansConfig config;

    public KMeansClusterer(KMeansConfig config) {
        this.config = Objects.requireNonNull(config, "KMeansConfig must not be null");
    }

    public KMeansConfig getConfig() {
        return config;
    }

    /**
     * Partition {@code points} into K clusters.
     *
     * @param points vectors to cluster, all of the same dimensionality
     * @return K frozen clusters in seed order, or an empty list if there are
     *         fewer than K points
     * @throws NullPointerException     if {@code points} is {@code null}
     * @throws IllegalArgumentException if the vectors differ in dimensionality
     */
    public List<Cluster> fit(List<FeatureVector> points) {
        Objects.requireNonNull(points, "points must not be null");
        int k = config.getK();
        if (points.size() < k) {
            LOG.debug("Insufficient points for clustering: {} < k={}", points.size(), k);
            return Collections.emptyList();
        }

        double[][] data = toMatrix(points);
        double[][] centroids = initialCentroids(data, k);
        int[] assignment = new int[data.length];

        int iteration = 0;
        boolean converged = false;
        while (iteration < config.getMaxIterations() && !converged) {
            double[][] previous = copy(centroids);
            assign(data, centroids, assignment);
            updateCentroids(data, centroids, assignment);
            converged = hasConverged(previous, centroids);
            iteration++;
        }

        if (converged) {
            LOG.debug("K-means converged after {} iteration(s) on {} point(s)", iteration, data.length);
        } else {
            LOG.debug("K-means stopped at maxIterations={} without converging", iteration);
        }
        return freeze(points, centroids, assignment);
    }

    /**
     * @param oldCentroids centroids before an iteration
     * @param newCentroids centroids after it
     * @return {@code true} if every centroid moved by at most the tolerance
     * @throws IllegalArgumentException if the arrays hold a different number
     *                                  of centroids
     */
    public boolean hasConverged(double[][] oldCentroids, double[][] newCentroids) {
        if (oldCentroids.length != newCentroids.length) {
            throw new IllegalArgumentException("Centroid count mismatch: "
                    + oldCentroids.length + " vs " + newCentroids.length);
        }
        for (int i = 0; i < newCentroids.length; i++) {
            if (Statistics.euclideanDistance(oldCentroids[i], newCentroids[i]) > config.getTolerance()) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Iteration steps
    // ---------------------------------------------------------------

    private static double[][] initialCentroids(double[][] data, int k) {
        double[][] centroids = new double[k][];
        for (int i = 0; i < k; i++) {
            centroids[i] = data[i * data.length / k].clone();
        }
        return centroids;
    }

    private static void assign(double[][] data, double[][] centroids, int[] assignment) {
        for (int p = 0; p < data.length; p++) {
            double minDistance = Double.POSITIVE_INFINITY;
            int nearest = 0;
            for (int c = 0; c < centroids.length; c++) {
                double distance = Statistics.euclideanDistance(data[p], centroids[c]);
                if (distance < minDistance) {
                    minDistance = distance;
                    nearest = c;
                }
            }
            assignment[p] = nearest;
        }
    }

    private static void updateCentroids(double[][] data, double[][] centroids, int[] assignment) {
        int dimensions = centroids[0].length;
        double[][] sums = new double[centroids.length][dimensions];
        int[] counts = new int[centroids.length];
        for (int p = 0; p < data.length; p++) {
            int c = assignment[p];
            counts[c]++;
            for (int d = 0; d < dimensions; d++) {
                sums[c][d] += data[p][d];
            }
        }
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] == 0) {
                continue; // empty cluster keeps its centroid
            }
            for (int d = 0; d < dimensions; d++) {
                centroids[c][d] = sums[c][d] / counts[c];
            }
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[][] toMatrix(List<FeatureVector> points) {
        double[][] data = new double[points.size()][];
        int dimensions = points.get(0).dimensions();
        for (int i = 0; i < data.length; i++) {
            FeatureVector point = Objects.requireNonNull(points.get(i), "Point at index " + i + " is null");
            if (point.dimensions() != dimensions) {
                throw new IllegalArgumentException("Point at index " + i + " has " + point.dimensions()
                        + " dimension(s), expected " + dimensions);
            }
            data[i] = point.toArray();
        }
        return data;
    }

    private static double[][] copy(double[][] centroids) {
        double[][] copy = new double[centroids.length][];
        for (int i = 0; i < centroids.length; i++) {
            copy[i] = centroids[i].clone();
        }
        return copy;
    }

    private static List<Cluster> freeze(List<FeatureVector> points, double[][] centroids, int[] assignment) {
        List<List<FeatureVector>> members = new ArrayList<>(centroids.length);
        for (int c = 0; c < centroids.length; c++) {
            members.add(new ArrayList<>());
        }
        for (int p = 0; p < assignment.length; p++) {
            members.get(assignment[p]).add(points.get(p));
        }
        List<Cluster> clusters = new ArrayList<>(centroids.length);
        for (int c = 0; c < centroids.length; c++) {
            clusters.add(new Cluster(centroids[c], members.get(c)));
        }
        return Collections.unmodifiableList(clusters);
    }
}
