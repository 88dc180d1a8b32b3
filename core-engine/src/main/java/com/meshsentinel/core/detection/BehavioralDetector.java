package com.meshsentinel.core.detection;

import com.meshsentinel.core.features.FeatureExtractor;
import com.meshsentinel.core.features.FeatureVector;
import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.AnomalyType;
import com.meshsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Distance-to-baseline check.
 *
 * <p>
 * Summarizes the most recent window of samples as a feature vector, measures
 * its distance to the nearest baseline centroid and compares it with the
 * baseline's dynamic threshold ({@link Baseline#distanceThreshold(double)}).
 * Severity is {@code distance / threshold}.
 * </p>
 *
 * <p>
 * Needs at least {@code windowSize + 1} samples, one full window plus the
 * sample that closes it; fewer samples simply skip the check.
 * </p>
 *
 * @since 1.0.0
 */
public class BehavioralDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BehavioralDetector.class);

    private final FeatureExtractor extractor;
    private final int windowSize;
    private final double sensitivityLevel;

    public BehavioralDetector(FeatureExtractor extractor, int windowSize, double sensitivityLevel) {
        this.extractor = Objects.requireNonNull(extractor, "FeatureExtractor must not be null");
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (sensitivityLevel <= 0) {
            throw new IllegalArgumentException("sensitivityLevel must be > 0, got: " + sensitivityLevel);
        }
        this.windowSize = windowSize;
        this.sensitivityLevel = sensitivityLevel;
    }

    /**
     * @param entity   the monitored entity
     * @param points   recent samples of the primary metric, in time order
     * @param baseline the entity's learned baseline
     * @return a behavioural anomaly if the latest window lies too far from
     *         every centroid, empty otherwise
     */
    public Optional<Anomaly> evaluate(String entity, List<Sample> points, Baseline baseline) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        if (points.size() <= windowSize) {
            LOG.trace("Skipping behavioural check for [{}]: {} point(s) for window {}",
                    entity, points.size(), windowSize);
            return Optional.empty();
        }

        List<FeatureVector> features = extractor.extractFeatures(points, windowSize);
        FeatureVector latest = features.get(features.size() - 1);

        double distance = baseline.nearestDistance(latest);
        double threshold = baseline.distanceThreshold(sensitivityLevel);

        if (distance <= threshold) {
            return Optional.empty();
        }

        // A zero threshold comes from a baseline with no spread at all
        double severity = threshold == 0 ? distance : distance / threshold;
        Sample trigger = latest.getTrigger().orElse(points.get(points.size() - 1));
        LOG.debug("Behavioural anomaly on [{}]: distance={} threshold={}", entity, distance, threshold);

        return Optional.of(Anomaly.builder()
                .type(AnomalyType.BEHAVIORAL_ANOMALY)
                .entity(entity)
                .severity(severity)
                .description(String.format("Behavioral anomaly detected (distance: %.2f, threshold: %.2f)",
                        distance, threshold))
                .timestamp(trigger.getTimestamp())
                .metric("anomaly_distance", distance)
                .metric("distance_threshold", threshold)
                .labels(trigger.getLabels())
                .build());
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getSensitivityLevel() {
        return sensitivityLevel;
    }
}
