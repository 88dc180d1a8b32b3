package com.meshsentinel.monitor;

import com.meshsentinel.core.detection.HybridAnomalyDetector;
import com.meshsentinel.core.detection.InsufficientDataException;
import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.Sample;
import com.meshsentinel.core.store.TimeSeriesStore;
import com.meshsentinel.monitor.source.MetricCollectionException;
import com.meshsentinel.monitor.source.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One pass over the mesh: read every entity, store the readings, then either
 * learn baselines or detect anomalies.
 *
 * <p>
 * Entities are handled independently. A failed collection is logged and the
 * entity is skipped for this tick; so is an entity without enough history to
 * learn from yet.
 * </p>
 *
 * @since 1.0.0
 */
public class MeshScanner {

    private static final Logger LOG = LoggerFactory.getLogger(MeshScanner.class);

    private final MetricSource source;
    private final TimeSeriesStore store;
    private final HybridAnomalyDetector detector;
    private final int historySize;
    private final List<String> entities;
    private final ScanMetrics metrics;

    /**
     * @param source      metric source
     * @param store       sample store
     * @param detector    anomaly detector
     * @param historySize samples per metric handed to the detector
     * @param entities    entities to scan; empty to scan whatever the source
     *                    discovers on each tick
     * @param metrics     counters updated by every scan
     */
    public MeshScanner(MetricSource source,
            TimeSeriesStore store,
            HybridAnomalyDetector detector,
            int historySize,
            List<String> entities,
            ScanMetrics metrics) {
        this.source = Objects.requireNonNull(source, "MetricSource must not be null");
        this.store = Objects.requireNonNull(store, "TimeSeriesStore must not be null");
        this.detector = Objects.requireNonNull(detector, "HybridAnomalyDetector must not be null");
        this.metrics = Objects.requireNonNull(metrics, "ScanMetrics must not be null");
        this.entities = List.copyOf(Objects.requireNonNull(entities, "entities must not be null"));
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got: " + historySize);
        }
        this.historySize = historySize;
    }

    /**
     * Run one tick.
     *
     * @param phase whether to learn or to detect after storing the readings
     * @return what happened to each entity
     */
    public ScanReport scan(ScanPhase phase) {
        Objects.requireNonNull(phase, "phase must not be null");

        List<String> scanned = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> learned = new ArrayList<>();
        List<Anomaly> anomalies = new ArrayList<>();

        for (String entity : targets()) {
            if (!record(entity)) {
                failed.add(entity);
                continue;
            }
            scanned.add(entity);

            if (phase == ScanPhase.LEARN) {
                if (learn(entity)) {
                    learned.add(entity);
                }
            } else {
                anomalies.addAll(detector.detectAcrossMetrics(entity, windowsOf(entity)));
            }
        }

        metrics.incrementTicks();
        metrics.addAnomaliesDetected(anomalies.size());
        ScanReport report = new ScanReport(phase, scanned, failed, learned, anomalies);
        LOG.debug("Scan finished: {}", report);
        return report;
    }

    public TimeSeriesStore getStore() {
        return store;
    }

    public HybridAnomalyDetector getDetector() {
        return detector;
    }

    public ScanMetrics getMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<String> targets() {
        return entities.isEmpty() ? source.discoverEntities() : entities;
    }

    /**
     * @return {@code false} if the entity could not be read this tick
     */
    private boolean record(String entity) {
        Map<String, Double> readings;
        try {
            readings = source.collect(entity);
        } catch (MetricCollectionException e) {
            LOG.warn("Skipping [{}] this tick: {}", entity, e.getMessage());
            metrics.incrementCollectionFailures();
            return false;
        }

        Map<String, String> labels = source.labelsOf(entity);
        new TreeMap<>(readings).forEach((metric, value) -> store.append(entity, metric, value, labels));
        metrics.incrementEntitiesScanned();
        return true;
    }

    private boolean learn(String entity) {
        String primary = detector.getSettings().getPrimaryMetric();
        List<Sample> history = store.latestN(entity, primary, historySize);
        try {
            detector.learnBaseline(entity, history);
            metrics.incrementBaselinesLearned();
            return true;
        } catch (InsufficientDataException e) {
            LOG.debug("No baseline for [{}] yet: {}", entity, e.getMessage());
            return false;
        }
    }

    private Map<String, List<Sample>> windowsOf(String entity) {
        Map<String, List<Sample>> windows = new LinkedHashMap<>();
        for (String metric : store.metricsOf(entity)) {
            windows.put(metric, store.latestN(entity, metric, historySize));
        }
        return windows;
    }
}
