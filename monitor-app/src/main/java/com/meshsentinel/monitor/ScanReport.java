package com.meshsentinel.monitor;

import com.meshsentinel.core.model.Anomaly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link MeshScanner#scan(ScanPhase)} call.
 *
 * @since 1.0.0
 */
public final class ScanReport {

    private final ScanPhase phase;
    private final List<String> scanned;
    private final List<String> failed;
    private final List<String> learned;
    private final List<Anomaly> anomalies;

    ScanReport(ScanPhase phase, List<String> scanned, List<String> failed,
            List<String> learned, List<Anomaly> anomalies) {
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
        this.scanned = Collections.unmodifiableList(new ArrayList<>(scanned));
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
        this.learned = Collections.unmodifiableList(new ArrayList<>(learned));
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    }

    public ScanPhase getPhase() {
        return phase;
    }

    /**
     * @return entities whose readings were stored this tick
     */
    public List<String> getScanned() {
        return scanned;
    }

    /**
     * @return entities whose readings could not be collected
     */
    public List<String> getFailed() {
        return failed;
    }

    /**
     * @return entities that got a new baseline (learn phase only)
     */
    public List<String> getLearned() {
        return learned;
    }

    /**
     * @return anomalies across all entities (detect phase only)
     */
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "ScanReport{" +
                "phase=" + phase +
                ", scanned=" + scanned.size() +
                ", failed=" + failed.size() +
                ", learned=" + learned.size() +
                ", anomalies=" + anomalies.size() +
                '}';
    }
}
