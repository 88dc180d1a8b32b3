package com.meshsentinel.core.detection;

import com.meshsentinel.core.features.Statistics;
import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.AnomalyType;
import com.meshsentinel.core.model.MetricNames;
import com.meshsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Traffic-spike rule.
 *
 * <p>
 * Compares the mean of the last {@value #RECENT_POINTS} samples with the mean
 * of every sample before them. Fires when
 * {@code recentMean > priorMean * threshold}; severity is
 * {@code recentMean / priorMean}, or 1.0 when the prior mean is 0 or negative.
 * </p>
 *
 * <p>
 * The rule needs {@value #RECENT_POINTS} samples. With exactly that many the
 * prior window is empty and its mean is 0.
 * </p>
 *
 * @since 1.0.0
 */
public class TrafficSpikeRule implements StaticRule {

    private static final Logger LOG = LoggerFactory.getLogger(TrafficSpikeRule.class);

    /** Size of the recent sub-window. */
    static final int RECENT_POINTS = 3;

    private final String metric;
    private final double threshold;

    /**
     * @param metric    metric the rule reads when wired per metric
     * @param threshold recent/prior ratio multiplier; must be &gt; 0
     * @throws IllegalArgumentException if {@code threshold <= 0}
     */
    public TrafficSpikeRule(String metric, double threshold) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (threshold <= 0) {
            throw new IllegalArgumentException("Traffic spike threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public TrafficSpikeRule(double threshold) {
        this(MetricNames.TRAFFIC_RPS, threshold);
    }

    @Override
    public Optional<Anomaly> evaluate(String entity, List<Sample> points) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(points, "points must not be null");

        if (points.size() < RECENT_POINTS) {
            return Optional.empty();
        }

        double[] values = Statistics.values(points);
        int split = values.length - RECENT_POINTS;
        double priorMean = Statistics.mean(Arrays.copyOfRange(values, 0, split));
        double recentMean = Statistics.mean(Arrays.copyOfRange(values, split, values.length));

        if (Double.isNaN(recentMean) || Double.isNaN(priorMean) || recentMean <= priorMean * threshold) {
            return Optional.empty();
        }

        // severity must stay >= 0
        double severity = priorMean <= 0 ? 1.0 : recentMean / priorMean;
        Sample latest = points.get(points.size() - 1);
        LOG.debug("Traffic spike on [{}]: recentMean={} priorMean={} threshold={}",
                entity, recentMean, priorMean, threshold);

        return Optional.of(Anomaly.builder()
                .type(AnomalyType.TRAFFIC_SPIKE)
                .entity(entity)
                .severity(severity)
                .description(String.format(
                        "Traffic spike detected: %.2f (recent mean %.2f vs prior mean %.2f)",
                        latest.getValue(), recentMean, priorMean))
                .timestamp(latest.getTimestamp())
                .metric("current_traffic", latest.getValue())
                .metric("recent_mean", recentMean)
                .metric("prior_mean", priorMean)
                .labels(latest.getLabels())
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TRAFFIC_SPIKE;
    }

    @Override
    public String getMetric() {
        return metric;
    }

    public double getThreshold() {
        return threshold;
    }
}
