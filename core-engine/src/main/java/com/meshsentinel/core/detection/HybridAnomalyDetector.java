package com.meshsentinel.core.detection;

import com.meshsentinel.core.clustering.Cluster;
import com.meshsentinel.core.clustering.KMeansClusterer;
import com.meshsentinel.core.config.DetectionSettings;
import com.meshsentinel.core.features.FeatureExtractor;
import com.meshsentinel.core.features.FeatureVector;
import com.meshsentinel.core.model.Anomaly;
import com.meshsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Hybrid anomaly detector: static threshold rules plus a distance check
 * against a learned per-entity baseline.
 *
 * <h3>Detection</h3>
 * <p>
 * Each call runs the static rules first and the behavioural check last, and
 * returns the anomalies in that order. The behavioural check only runs when
 * the entity has a baseline; static rules never need one. Static rules are
 * skipped on series shorter than {@value #MIN_STATIC_POINTS} samples.
 * </p>
 *
 * <h3>Learning</h3>
 * <p>
 * {@link #learnBaseline(String, List)} extracts features over the whole input,
 * clusters them and replaces the entity's baseline. A failed learn leaves the
 * previous baseline in place.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Baselines are immutable and swapped atomically in
 * the {@link BaselineRegistry}, so learning and detecting for the same entity
 * from different threads never observe a half-built baseline.
 * </p>
 *
 * @since 1.0.0
 */
public class HybridAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(HybridAnomalyDetector.class);

    /** Minimum series length for static rules to be evaluated. */
    static final int MIN_STATIC_POINTS = 2;

    private final DetectionSettings settings;
    private final FeatureExtractor extractor;
    private final KMeansClusterer clusterer;
    private final BaselineRegistry registry;
    private final Clock clock;
    private final List<StaticRule> singleSeriesRules;
    private final List<StaticRule> allRules;
    private final BehavioralDetector behavioralDetector;

    public HybridAnomalyDetector(DetectionSettings settings, KMeansClusterer clusterer) {
        this(settings, new FeatureExtractor(), clusterer, new BaselineRegistry(), Clock.systemUTC());
    }

    /**
     * @param settings  detection thresholds; validated on construction
     * @param extractor feature extractor
     * @param clusterer clustering engine used for learning
     * @param registry  baseline storage
     * @param clock     source of baseline timestamps
     * @throws IllegalStateException if {@code settings} are invalid
     */
    public HybridAnomalyDetector(DetectionSettings settings,
            FeatureExtractor extractor,
            KMeansClusterer clusterer,
            BaselineRegistry registry,
            Clock clock) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.extractor = Objects.requireNonNull(extractor, "FeatureExtractor must not be null");
        this.clusterer = Objects.requireNonNull(clusterer, "KMeansClusterer must not be null");
        this.registry = Objects.requireNonNull(registry, "BaselineRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        settings.validate();

        this.singleSeriesRules = StaticRuleFactory.createSingleSeries(settings);
        this.allRules = StaticRuleFactory.createAll(settings);
        this.behavioralDetector = new BehavioralDetector(
                extractor, settings.getWindowSize(), settings.getSensitivityLevel());
    }

    // ---------------------------------------------------------------
    // Learning
    // ---------------------------------------------------------------

    /**
     * Learn and install a new baseline for {@code entity}.
     *
     * @param entity the monitored entity
     * @param points history of the primary metric, in time order
     * @return the installed baseline
     * @throws InsufficientDataException if there are fewer points than the
     *                                   window size, or too few windows to
     *                                   form K clusters
     */
    public Baseline learnBaseline(String entity, List<Sample> points) throws InsufficientDataException {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(points, "points must not be null");

        int windowSize = settings.getWindowSize();
        if (points.size() < windowSize) {
            throw new InsufficientDataException(entity, windowSize, points.size(), "data points");
        }

        List<FeatureVector> features = extractor.extractFeatures(points, windowSize);
        List<Cluster> clusters = clusterer.fit(features);
        if (clusters.isEmpty()) {
            throw new InsufficientDataException(
                    entity, clusterer.getConfig().getK(), features.size(), "feature windows");
        }

        Baseline baseline = new Baseline(entity, clusters, clock.instant());
        Optional<Baseline> replaced = registry.put(baseline);
        LOG.info("Learned baseline for [{}]: {} cluster(s) from {} window(s){}",
                entity, clusters.size(), features.size(), replaced.isPresent() ? " (replaced previous)" : "");
        return baseline;
    }

    public boolean hasBaseline(String entity) {
        return registry.contains(entity);
    }

    public Optional<Baseline> baselineOf(String entity) {
        return registry.find(entity);
    }

    /**
     * Drop the baseline of {@code entity}; its next detections run static
     * rules only.
     *
     * @return {@code true} if a baseline was removed
     */
    public boolean forgetBaseline(String entity) {
        return registry.remove(entity).isPresent();
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Detect anomalies in one series.
     *
     * <p>
     * Runs the traffic-spike and error-rate rules over {@code recentPoints},
     * then the behavioural check if a baseline exists.
     * </p>
     *
     * @return anomalies, static first; never {@code null}
     */
    public List<Anomaly> detectAnomalies(String entity, List<Sample> recentPoints) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(recentPoints, "recentPoints must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (StaticRule rule : singleSeriesRules) {
            evaluateStatic(rule, entity, recentPoints, anomalies);
        }
        evaluateBehavioral(entity, recentPoints, anomalies);
        return Collections.unmodifiableList(anomalies);
    }

    /**
     * Detect anomalies with every static rule reading its own metric.
     *
     * <p>
     * Rules whose metric is absent from {@code windowsByMetric} are skipped.
     * The behavioural check runs on the configured primary metric.
     * </p>
     *
     * @param windowsByMetric recent samples keyed by metric name
     * @return anomalies, static first; never {@code null}
     */
    public List<Anomaly> detectAcrossMetrics(String entity, Map<String, List<Sample>> windowsByMetric) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(windowsByMetric, "windowsByMetric must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (StaticRule rule : allRules) {
            List<Sample> points = windowsByMetric.get(rule.getMetric());
            if (points != null) {
                evaluateStatic(rule, entity, points, anomalies);
            }
        }
        List<Sample> primary = windowsByMetric.get(settings.getPrimaryMetric());
        if (primary != null) {
            evaluateBehavioral(entity, primary, anomalies);
        }
        return Collections.unmodifiableList(anomalies);
    }

    public DetectionSettings getSettings() {
        return settings;
    }

    public BaselineRegistry getRegistry() {
        return registry;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void evaluateStatic(StaticRule rule, String entity, List<Sample> points, List<Anomaly> out) {
        if (points.size() < MIN_STATIC_POINTS) {
            return;
        }
        rule.evaluate(entity, points).ifPresent(out::add);
    }

    private void evaluateBehavioral(String entity, List<Sample> points, List<Anomaly> out) {
        // Read the registry once so the whole check uses a single baseline
        Optional<Baseline> baseline = registry.find(entity);
        baseline.flatMap(b -> behavioralDetector.evaluate(entity, points, b)).ifPresent(out::add);
    }
}
