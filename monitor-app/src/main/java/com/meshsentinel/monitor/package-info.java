/**
 * Mesh Sentinel monitor application.
 *
 * <p>
 * Polls a {@link com.meshsentinel.monitor.source.MetricSource}, stores the
 * readings, learns per-entity baselines and reports anomalies. Wiring lives
 * in {@link com.meshsentinel.monitor.MeshSentinelApp}; the tick logic in
 * {@link com.meshsentinel.monitor.MeshScanner} and
 * {@link com.meshsentinel.monitor.MonitorLoop}.
 * </p>
 *
 * @since 1.0.0
 */
package com.meshsentinel.monitor;
