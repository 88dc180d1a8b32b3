package com.meshsentinel.core.store;

import com.meshsentinel.core.model.Sample;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Insertion-ordered samples of one metric for one entity.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Each series owns a {@link ReadWriteLock}. Appends take the write lock;
 * every read takes the read lock for its whole duration and returns a copy,
 * so callers see a consistent snapshot of the series at the time of the call.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private final SeriesKey key;
    private final RetentionPolicy retention;
    private final Deque<Sample> points = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    TimeSeries(SeriesKey key, RetentionPolicy retention) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
    }

    public SeriesKey getKey() {
        return key;
    }

    public String getEntity() {
        return key.getEntity();
    }

    public String getMetric() {
        return key.getMetric();
    }

    /**
     * Append a sample stamped inside the write lock, then drop whatever the
     * retention policy no longer allows.
     */
    Sample append(Clock clock, double value, Map<String, String> labels) {
        lock.writeLock().lock();
        try {
            Sample sample = new Sample(clock.instant(), value, labels);
            points.addLast(sample);
            applyRetention(sample.getTimestamp());
            return sample;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return points.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copy of every retained sample in insertion order
     */
    public List<Sample> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(points));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param n maximum number of samples
     * @return the last {@code min(n, size)} samples in insertion order; empty
     *         when {@code n <= 0}
     */
    public List<Sample> latest(int n) {
        if (n <= 0) {
            return Collections.emptyList();
        }
        lock.readLock().lock();
        try {
            int count = Math.min(n, points.size());
            Sample[] tail = new Sample[count];
            Iterator<Sample> it = points.descendingIterator();
            for (int i = count - 1; i >= 0; i--) {
                tail[i] = it.next();
            }
            return List.of(tail);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return samples with {@code start < timestamp < end}, in insertion order
     */
    public List<Sample> between(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        lock.readLock().lock();
        try {
            List<Sample> result = new ArrayList<>();
            for (Sample sample : points) {
                Instant ts = sample.getTimestamp();
                if (ts.isAfter(start) && ts.isBefore(end)) {
                    result.add(sample);
                }
            }
            return Collections.unmodifiableList(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void applyRetention(Instant now) {
        if (retention.isUnbounded()) {
            return;
        }
        while (retention.exceedsCount(points.size())) {
            points.pollFirst();
        }
        while (!points.isEmpty() && retention.isExpired(points.peekFirst().getTimestamp(), now)) {
            points.pollFirst();
        }
    }

    @Override
    public String toString() {
        return "TimeSeries{key=" + key + ", size=" + size() + '}';
    }
}
