package com.meshsentinel.core.detection;

import com.meshsentinel.core.features.Statistics;
import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.AnomalyType;
import com.meshsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Latest-value threshold rule.
 *
 * <p>
 * Fires when the most recent sample is strictly above the threshold. Severity
 * is {@code latest / threshold}, or 1.0 for a zero threshold. One class
 * serves error rate, latency, retries, timeouts and circuit breakers; they
 * differ only in type, metric, threshold and wording.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRule implements StaticRule {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdRule.class);

    private final AnomalyType type;
    private final String metric;
    private final double threshold;
    private final String descriptionFormat;
    private final double displayScale;

    /**
     * @param type              anomaly type emitted
     * @param metric            metric read when wired per metric; also the key
     *                          of the value in the anomaly's metrics
     * @param threshold         value above which the rule fires; must be &ge; 0
     * @param descriptionFormat format receiving the scaled value and threshold
     *                          as two {@code double} arguments
     * @param displayScale      factor applied to both numbers in the description
     * @throws IllegalArgumentException if {@code threshold < 0} or the type is
     *                                  not a static kind
     */
    public ThresholdRule(AnomalyType type, String metric, double threshold,
            String descriptionFormat, double displayScale) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.descriptionFormat = Objects.requireNonNull(descriptionFormat, "descriptionFormat must not be null");
        if (type == AnomalyType.BEHAVIORAL_ANOMALY) {
            throw new IllegalArgumentException("Behavioural anomalies are not threshold based");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException(
                    "threshold must be >= 0 for " + type + ", got: " + threshold);
        }
        this.threshold = threshold;
        this.displayScale = displayScale;
    }

    @Override
    public Optional<Anomaly> evaluate(String entity, List<Sample> points) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(points, "points must not be null");

        if (points.isEmpty()) {
            return Optional.empty();
        }

        Sample latest = points.get(points.size() - 1);
        double v = latest.getValue();

        if (v > threshold) {
            LOG.debug("Rule [{}] fired on [{}]: {}={} > threshold={}", type, entity, metric, v, threshold);

            return Optional.of(Anomaly.builder()
                    .type(type)
                    .entity(entity)
                    .severity(Statistics.ratio(v, threshold))
                    .description(String.format(descriptionFormat, v * displayScale, threshold * displayScale))
                    .timestamp(latest.getTimestamp())
                    .metric(metric, v)
                    .labels(latest.getLabels())
                    .build());
        }

        return Optional.empty();
    }

    @Override
    public AnomalyType getType() {
        return type;
    }

    @Override
    public String getMetric() {
        return metric;
    }

    public double getThreshold() {
        return threshold;
    }
}
