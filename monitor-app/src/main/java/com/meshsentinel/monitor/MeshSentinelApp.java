package com.meshsentinel.monitor;

import com.meshsentinel.core.clustering.KMeansClusterer;
import com.meshsentinel.core.config.ConfigLoader;
import com.meshsentinel.core.config.MonitorSettings;
import com.meshsentinel.core.config.SentinelConfig;
import com.meshsentinel.core.detection.BaselineRegistry;
import com.meshsentinel.core.detection.HybridAnomalyDetector;
import com.meshsentinel.core.features.FeatureExtractor;
import com.meshsentinel.core.store.TimeSeriesStore;
import com.meshsentinel.monitor.output.OutputFormat;
import com.meshsentinel.monitor.source.MetricSource;
import com.meshsentinel.monitor.source.SimulatedMetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Main entry point for the Mesh Sentinel monitor.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   MetricSource (one reading per entity per tick)
 *     → TimeSeriesStore
 *     → learn ticks: HybridAnomalyDetector.learnBaseline
 *     → detect ticks: HybridAnomalyDetector.detectAcrossMetrics
 *     → AnomalyRenderer → stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via {@link MonitorConfig};
 * detection tuning from YAML via {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MeshSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(MeshSentinelApp.class);

    private MeshSentinelApp() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        MonitorConfig config = MonitorConfig.fromEnvironment();
        SentinelConfig sentinelConfig = loadSentinelConfig(config);
        LOG.info("Starting Mesh Sentinel with config: {}", config);

        // 2. Wire the pipeline
        MetricSource source = new SimulatedMetricSource(
                config.getEntities(), config.getSimulationSeed(), config.getFaultProbability());
        ScanMetrics metrics = new ScanMetrics();
        MonitorLoop loop = buildLoop(sentinelConfig, config, source, metrics, System.out);

        // 3. Scan mode: one pass and exit
        if (config.getMode() == RunMode.SCAN) {
            loop.runScan();
            return;
        }

        // 4. Monitor mode: health server and fixed-delay loop with shutdown hook
        HealthServer healthServer = null;
        if (config.isHealthEnabled()) {
            healthServer = new HealthServer(metrics, registryOf(loop), loop::currentPhase);
            healthServer.start(config.getHealthPort());
        }
        HealthServer health = healthServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.stop();
            if (health != null) {
                health.stop();
            }
        }, "sentinel-shutdown"));

        loop.start();
        loop.awaitTermination();
    }

    // ---------------------------------------------------------------
    // Wiring (extracted for readability and testability)
    // ---------------------------------------------------------------

    /**
     * Assemble store, detector, scanner and loop from configuration.
     */
    static MonitorLoop buildLoop(SentinelConfig sentinelConfig,
            MonitorConfig config,
            MetricSource source,
            ScanMetrics metrics,
            PrintStream out) {
        MonitorSettings monitor = sentinelConfig.getMonitor();

        TimeSeriesStore store = new TimeSeriesStore(Clock.systemUTC(), monitor.toRetentionPolicy());
        HybridAnomalyDetector detector = new HybridAnomalyDetector(
                sentinelConfig.getDetection(),
                new FeatureExtractor(),
                new KMeansClusterer(sentinelConfig.getClustering().toKMeansConfig()),
                new BaselineRegistry(),
                Clock.systemUTC());
        MeshScanner scanner = new MeshScanner(
                source, store, detector, monitor.getHistorySize(), config.getEntities(), metrics);

        return new MonitorLoop(
                scanner,
                OutputFormat.fromName(sentinelConfig.getOutput().getFormat()).newRenderer(),
                out,
                monitor.getIntervalSeconds(),
                monitor.getLearningTicks(),
                sentinelConfig.getOutput().isVerbose());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SentinelConfig loadSentinelConfig(MonitorConfig config) {
        String path = config.getConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }

    private static BaselineRegistry registryOf(MonitorLoop loop) {
        return loop.getScanner().getDetector().getRegistry();
    }
}
