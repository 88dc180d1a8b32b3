package com.meshsentinel.core.detection;

import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.AnomalyType;
import com.meshsentinel.core.model.Sample;

import java.util.List;
import java.util.Optional;

/**
 * Contract for baseline-free detection rules.
 * <p>
 * A rule inspects the most recent samples of one metric and decides whether
 * they cross a fixed threshold. Rules are stateless: every call is judged on
 * the samples passed in, so one instance can serve every entity and thread.
 * </p>
 */
public interface StaticRule {

    /**
     * Evaluate the recent samples of one entity.
     *
     * @param entity the monitored entity
     * @param points recent samples in time order
     * @return an {@link Anomaly} if the rule fires, empty otherwise
     */
    Optional<Anomaly> evaluate(String entity, List<Sample> points);

    /**
     * @return the kind of anomaly this rule emits
     */
    AnomalyType getType();

    /**
     * @return the metric whose series this rule reads when metrics are wired
     *         individually
     */
    String getMetric();
}
