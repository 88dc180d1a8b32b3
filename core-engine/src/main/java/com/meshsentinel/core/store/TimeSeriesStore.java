package com.meshsentinel.core.store;

import com.meshsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory, append-only store of {@link TimeSeries}, one per
 * {@code (entity, metric)} pair.
 *
 * <h3>Locking</h3>
 * <p>
 * Two levels. A store-wide {@link ReadWriteLock} guards the key-to-series map:
 * lookups take the read lock, creating a new series takes the write lock.
 * Each series then has its own lock for appends and reads, so writers to
 * different series never contend while writers to the same series serialize.
 * </p>
 *
 * <h3>Retention</h3>
 * <p>
 * The store never deletes a series. Samples inside a series are kept according
 * to the configured {@link RetentionPolicy}, which defaults to
 * {@link RetentionPolicy#unbounded()}.
 * </p>
 *
 * <p>
 * Unknown keys are not an error: every read returns an empty result.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesStore.class);

    private final Clock clock;
    private final RetentionPolicy retention;
    private final Map<SeriesKey, TimeSeries> series = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public TimeSeriesStore() {
        this(Clock.systemUTC(), RetentionPolicy.unbounded());
    }

    public TimeSeriesStore(Clock clock) {
        this(clock, RetentionPolicy.unbounded());
    }

    /**
     * @param clock     source of sample timestamps; must not be {@code null}
     * @param retention per-series retention; must not be {@code null}
     */
    public TimeSeriesStore(Clock clock, RetentionPolicy retention) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Record a sample stamped with the current clock time, creating the series
     * on first use.
     *
     * @param entity entity name; must not be {@code null}
     * @param metric metric name; must not be {@code null}
     * @param value  observed value
     * @param labels sample labels; may be {@code null}
     * @return the stored sample
     */
    public Sample append(String entity, String metric, double value, Map<String, String> labels) {
        TimeSeries target = seriesFor(SeriesKey.of(entity, metric));
        // Timestamp is taken by the series itself so that concurrent writers to
        // one series store samples in timestamp order.
        return target.append(clock, value, labels);
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public Optional<TimeSeries> get(String entity, String metric) {
        SeriesKey key = SeriesKey.of(entity, metric);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(series.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return samples with {@code start < timestamp < end}; empty if the
     *         series does not exist
     */
    public List<Sample> rangeBetween(String entity, String metric, Instant start, Instant end) {
        return get(entity, metric)
                .map(s -> s.between(start, end))
                .orElse(Collections.emptyList());
    }

    /**
     * @return the last {@code min(n, size)} samples in insertion order; empty
     *         if the series does not exist
     */
    public List<Sample> latestN(String entity, String metric, int n) {
        return get(entity, metric)
                .map(s -> s.latest(n))
                .orElse(Collections.emptyList());
    }

    /**
     * @return sorted names of every metric recorded for {@code entity}
     */
    public Set<String> metricsOf(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        Set<String> metrics = new TreeSet<>();
        lock.readLock().lock();
        try {
            for (SeriesKey key : series.keySet()) {
                if (key.getEntity().equals(entity)) {
                    metrics.add(key.getMetric());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableSet(metrics);
    }

    public List<SeriesKey> keys() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(series.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int seriesCount() {
        lock.readLock().lock();
        try {
            return series.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public RetentionPolicy getRetention() {
        return retention;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private TimeSeries seriesFor(SeriesKey key) {
        lock.readLock().lock();
        try {
            TimeSeries existing = series.get(key);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // Re-check: another writer may have created it between the locks
            return series.computeIfAbsent(key, k -> {
                LOG.debug("Creating series {} with {}", k, retention);
                return new TimeSeries(k, retention);
            });
        } finally {
            lock.writeLock().unlock();
        }
    }
}
