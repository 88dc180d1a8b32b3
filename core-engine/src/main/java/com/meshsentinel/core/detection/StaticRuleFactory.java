package com.meshsentinel.core.detection;

import com.meshsentinel.core.config.DetectionSettings;
import com.meshsentinel.core.model.AnomalyType;
import com.meshsentinel.core.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Factory that creates {@link StaticRule} instances from
 * {@link DetectionSettings}.
 *
 * <p>
 * This is the single point of extension when adding a static anomaly type:
 * add the constant to {@link AnomalyType} and the compiler points here.
 * </p>
 *
 * @since 1.0.0
 */
public final class StaticRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StaticRuleFactory.class);

    /** Rules evaluated on a single series, in emission order. */
    static final Set<AnomalyType> SINGLE_SERIES_TYPES =
            Collections.unmodifiableSet(EnumSet.of(AnomalyType.TRAFFIC_SPIKE, AnomalyType.ERROR_RATE_HIGH));

    private StaticRuleFactory() {
        // utility class — not instantiable
    }

    /**
     * Create the rule for one anomaly type.
     *
     * @param type     a static anomaly type
     * @param settings thresholds; must not be {@code null}
     * @return the configured rule
     * @throws IllegalArgumentException for {@link AnomalyType#BEHAVIORAL_ANOMALY},
     *                                  which is not a static rule
     */
    public static StaticRule create(AnomalyType type, DetectionSettings settings) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(settings, "DetectionSettings must not be null");

        return switch (type) {
            case TRAFFIC_SPIKE -> new TrafficSpikeRule(MetricNames.TRAFFIC_RPS, settings.getTrafficSpikeThreshold());
            case ERROR_RATE_HIGH -> new ThresholdRule(type, MetricNames.ERROR_RATE,
                    settings.getErrorRateThreshold(), "High error rate: %.2f%% (threshold: %.2f%%)", 100);
            case LATENCY_ANOMALY -> new ThresholdRule(type, MetricNames.LATENCY_P99,
                    settings.getLatencyThresholdMs(), "High p99 latency: %.0f ms (threshold: %.0f ms)", 1);
            case CIRCUIT_BREAKER -> new ThresholdRule(type, MetricNames.CIRCUIT_BREAKERS_OPEN,
                    settings.getCircuitBreakerThreshold(), "Circuit breakers open: %.0f (threshold: %.0f)", 1);
            case RETRY_STORM -> new ThresholdRule(type, MetricNames.RETRY_COUNT,
                    settings.getRetryThreshold(), "Retry storm: %.0f retries (threshold: %.0f)", 1);
            case TIMEOUT_ANOMALY -> new ThresholdRule(type, MetricNames.TIMEOUT_COUNT,
                    settings.getTimeoutThreshold(), "Timeout anomaly: %.0f timeouts (threshold: %.0f)", 1);
            case BEHAVIORAL_ANOMALY -> throw new IllegalArgumentException(
                    "Behavioural anomalies need a learned baseline, not a static rule");
        };
    }

    /**
     * Create every static rule, in {@link AnomalyType} declaration order.
     *
     * @return unmodifiable list of rules
     */
    public static List<StaticRule> createAll(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        List<StaticRule> rules = EnumSet.complementOf(EnumSet.of(AnomalyType.BEHAVIORAL_ANOMALY)).stream()
                .map(type -> create(type, settings))
                .toList();
        LOG.info("Created {} static rule(s)", rules.size());
        return rules;
    }

    /**
     * Create the rules that run when the detector is handed a single series:
     * traffic spike, then high error rate.
     *
     * @return unmodifiable list of rules
     */
    public static List<StaticRule> createSingleSeries(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        return SINGLE_SERIES_TYPES.stream()
                .map(type -> create(type, settings))
                .toList();
    }
}
