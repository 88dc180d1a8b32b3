package com.meshsentinel.core.store;

import com.meshsentinel.core.model.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeriesStore}.
 */
class TimeSeriesStoreTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private SteppingClock clock;
    private TimeSeriesStore store;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(BASE);
        store = new TimeSeriesStore(clock);
    }

    @Test
    @DisplayName("Should stamp appended samples with the clock time")
    void shouldStampWithClock() {
        Sample sample = store.append("checkout", "request_count", 42, Map.of("pod", "a"));

        assertThat(sample.getTimestamp()).isEqualTo(BASE);
        assertThat(sample.getValue()).isEqualTo(42);
        assertThat(sample.getLabels()).containsEntry("pod", "a");
    }

    @Test
    @DisplayName("Should return the last N samples in insertion order")
    void shouldReturnLatestN() {
        appendValues("checkout", "request_count", 1, 2, 3, 4, 5);

        List<Sample> latest = store.latestN("checkout", "request_count", 3);

        assertThat(latest).extracting(Sample::getValue).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should return the whole series when N exceeds its size")
    void shouldCapLatestNAtSize() {
        appendValues("checkout", "request_count", 1, 2);

        assertThat(store.latestN("checkout", "request_count", 10)).hasSize(2);
        assertThat(store.latestN("checkout", "request_count", 0)).isEmpty();
        assertThat(store.latestN("checkout", "request_count", -1)).isEmpty();
    }

    @Test
    @DisplayName("Should exclude both range bounds")
    void shouldExcludeRangeBounds() {
        appendValues("checkout", "request_count", 10, 20, 30, 40);

        List<Sample> range = store.rangeBetween("checkout", "request_count",
                BASE, BASE.plusSeconds(3));

        // samples at +0s and +3s sit on the bounds
        assertThat(range).extracting(Sample::getValue).containsExactly(20.0, 30.0);
    }

    @Test
    @DisplayName("Should return empty results for an unknown series")
    void shouldReturnEmptyForUnknownSeries() {
        assertThat(store.get("ghost", "request_count")).isEmpty();
        assertThat(store.latestN("ghost", "request_count", 5)).isEmpty();
        assertThat(store.rangeBetween("ghost", "request_count", BASE, BASE.plusSeconds(60))).isEmpty();
    }

    @Test
    @DisplayName("Should keep series of different metrics apart")
    void shouldSeparateSeriesByMetric() {
        store.append("checkout", "request_count", 100, null);
        store.append("checkout", "error_rate", 0.01, null);
        store.append("payments", "request_count", 7, null);

        assertThat(store.seriesCount()).isEqualTo(3);
        assertThat(store.metricsOf("checkout")).containsExactly("error_rate", "request_count");
        assertThat(store.keys()).contains(SeriesKey.of("payments", "request_count"));
        assertThat(store.latestN("payments", "request_count", 5))
                .extracting(Sample::getValue).containsExactly(7.0);
    }

    @Test
    @DisplayName("Should drop the oldest samples beyond the point cap")
    void shouldApplyPointRetention() {
        store = new TimeSeriesStore(clock, RetentionPolicy.maxPoints(3));
        appendValues("checkout", "request_count", 1, 2, 3, 4, 5);

        TimeSeries series = store.get("checkout", "request_count").orElseThrow();
        assertThat(series.size()).isEqualTo(3);
        assertThat(series.snapshot()).extracting(Sample::getValue).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should drop samples older than the age limit")
    void shouldApplyAgeRetention() {
        store = new TimeSeriesStore(clock, RetentionPolicy.maxAge(Duration.ofSeconds(2)));
        appendValues("checkout", "request_count", 1, 2, 3, 4, 5);

        // newest at +4s, so +2s is the oldest still within two seconds
        assertThat(store.latestN("checkout", "request_count", 10))
                .extracting(Sample::getValue).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should reject null entity or metric")
    void shouldRejectNullKeyParts() {
        assertThatThrownBy(() -> store.append(null, "request_count", 1, null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> store.append("checkout", null, 1, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should not lose samples under concurrent appends")
    void shouldHandleConcurrentAppends() throws Exception {
        store = new TimeSeriesStore();
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                String entity = "svc-" + (t % 2);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.append(entity, "request_count", i, null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.seriesCount()).isEqualTo(2);
        int total = store.get("svc-0", "request_count").orElseThrow().size()
                + store.get("svc-1", "request_count").orElseThrow().size();
        assertThat(total).isEqualTo(threads * perThread);

        List<Sample> samples = store.get("svc-0", "request_count").orElseThrow().snapshot();
        for (int i = 1; i < samples.size(); i++) {
            assertThat(samples.get(i).getTimestamp()).isAfterOrEqualTo(samples.get(i - 1).getTimestamp());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void appendValues(String entity, String metric, double... values) {
        for (double v : values) {
            store.append(entity, metric, v, null);
            clock.advance(Duration.ofSeconds(1));
        }
        clock.rewind(Duration.ofSeconds(1));
    }

    /**
     * Clock that only moves when told to.
     */
    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        void rewind(Duration d) {
            now = now.minus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
