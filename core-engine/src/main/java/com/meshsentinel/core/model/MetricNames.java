package com.meshsentinel.core.model;

/**
 * Well-known metric names recorded per entity.
 *
 * <p>
 * The first four are the golden signals collected from sidecar proxies;
 * the rest feed the resilience rules.
 * </p>
 */
public final class MetricNames {

    public static final String TRAFFIC_RPS = "traffic_rps";
    public static final String LATENCY_P99 = "latency_p99";
    public static final String ERROR_RATE = "error_rate";
    public static final String SATURATION_CPU = "saturation_cpu";

    public static final String REQUEST_COUNT = "request_count";
    public static final String RESPONSE_TIME = "response_time";

    public static final String RETRY_COUNT = "retry_count";
    public static final String TIMEOUT_COUNT = "timeout_count";
    public static final String CIRCUIT_BREAKERS_OPEN = "circuit_breakers_open";

    private MetricNames() {
        // constants holder
    }
}
