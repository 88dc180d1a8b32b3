/**
 * Hybrid anomaly detection engine.
 *
 * <p>
 * {@link com.meshsentinel.core.detection.HybridAnomalyDetector} combines:
 * </p>
 * <ul>
 * <li>{@link com.meshsentinel.core.detection.StaticRule}s built by
 * {@link com.meshsentinel.core.detection.StaticRuleFactory} —
 * {@link com.meshsentinel.core.detection.TrafficSpikeRule} and
 * {@link com.meshsentinel.core.detection.ThresholdRule}</li>
 * <li>{@link com.meshsentinel.core.detection.BehavioralDetector} — distance
 * to the entity's learned {@link com.meshsentinel.core.detection.Baseline}</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a static rule, add a constant to
 * {@link com.meshsentinel.core.model.AnomalyType}, implement
 * {@code StaticRule} and map the constant in {@code StaticRuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.detection;
