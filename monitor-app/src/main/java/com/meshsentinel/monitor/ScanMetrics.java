package com.meshsentinel.monitor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of the monitor, read by the health endpoint.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code ticks_total}: scan ticks completed</li>
 * <li>{@code entities_scanned_total}: entity readings stored</li>
 * <li>{@code collection_failures_total}: entity readings that failed</li>
 * <li>{@code baselines_learned_total}: successful baseline fits</li>
 * <li>{@code anomalies_detected_total}: anomalies reported</li>
 * </ul>
 */
public class ScanMetrics {

    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong entitiesScanned = new AtomicLong();
    private final AtomicLong collectionFailures = new AtomicLong();
    private final AtomicLong baselinesLearned = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();

    public void incrementTicks() {
        ticks.incrementAndGet();
    }

    public void incrementEntitiesScanned() {
        entitiesScanned.incrementAndGet();
    }

    public void incrementCollectionFailures() {
        collectionFailures.incrementAndGet();
    }

    public void incrementBaselinesLearned() {
        baselinesLearned.incrementAndGet();
    }

    public void addAnomaliesDetected(int count) {
        anomaliesDetected.addAndGet(count);
    }

    public long getTicks() {
        return ticks.get();
    }

    public long getEntitiesScanned() {
        return entitiesScanned.get();
    }

    public long getCollectionFailures() {
        return collectionFailures.get();
    }

    public long getBaselinesLearned() {
        return baselinesLearned.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }

    /**
     * @return counter name to value, in a stable order
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        snapshot.put("ticks_total", getTicks());
        snapshot.put("entities_scanned_total", getEntitiesScanned());
        snapshot.put("collection_failures_total", getCollectionFailures());
        snapshot.put("baselines_learned_total", getBaselinesLearned());
        snapshot.put("anomalies_detected_total", getAnomaliesDetected());
        return snapshot;
    }
}
