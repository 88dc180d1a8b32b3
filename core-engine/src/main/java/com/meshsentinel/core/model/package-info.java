/**
 * Domain model classes for Mesh Sentinel.
 *
 * <p>
 * This package contains the value types shared between the detection engine
 * and the monitor layer:
 * </p>
 * <ul>
 * <li>{@link com.meshsentinel.core.model.Sample} — one timestamped metric
 * observation</li>
 * <li>{@link com.meshsentinel.core.model.Anomaly} — anomaly record emitted by
 * the detector</li>
 * <li>{@link com.meshsentinel.core.model.AnomalyType} — closed set of anomaly
 * kinds</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.meshsentinel.core.model;
