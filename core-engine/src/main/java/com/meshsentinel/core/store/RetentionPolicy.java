package com.meshsentinel.core.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounds how many samples a {@link TimeSeries} keeps.
 *
 * <p>
 * A policy may cap the number of samples per series (ring-buffer behaviour,
 * oldest dropped first), the age of samples relative to the newest append, or
 * both. {@link #unbounded()} keeps everything.
 * </p>
 *
 * <p>
 * Retention is applied on append, under the series write lock, so readers
 * never observe a series above its bound.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetentionPolicy {

    private static final RetentionPolicy UNBOUNDED = new RetentionPolicy(0, null);

    /** Maximum samples per series; 0 means no cap. */
    private final int maxPoints;

    /** Maximum sample age; {@code null} means no age limit. */
    private final Duration maxAge;

    private RetentionPolicy(int maxPoints, Duration maxAge) {
        this.maxPoints = maxPoints;
        this.maxAge = maxAge;
    }

    public static RetentionPolicy unbounded() {
        return UNBOUNDED;
    }

    /**
     * @param maxPoints samples kept per series; must be &gt; 0
     * @throws IllegalArgumentException if {@code maxPoints} is not positive
     */
    public static RetentionPolicy maxPoints(int maxPoints) {
        return new RetentionPolicy(requirePositive(maxPoints), null);
    }

    /**
     * @param maxAge oldest sample age kept; must be positive
     * @throws IllegalArgumentException if {@code maxAge} is zero or negative
     */
    public static RetentionPolicy maxAge(Duration maxAge) {
        return new RetentionPolicy(0, requirePositive(maxAge));
    }

    /**
     * Combine this policy with a sample-count cap.
     */
    public RetentionPolicy withMaxPoints(int maxPoints) {
        return new RetentionPolicy(requirePositive(maxPoints), maxAge);
    }

    /**
     * Combine this policy with an age limit.
     */
    public RetentionPolicy withMaxAge(Duration maxAge) {
        return new RetentionPolicy(this.maxPoints, requirePositive(maxAge));
    }

    public boolean isUnbounded() {
        return maxPoints == 0 && maxAge == null;
    }

    public Optional<Integer> getMaxPoints() {
        return maxPoints > 0 ? Optional.of(maxPoints) : Optional.empty();
    }

    public Optional<Duration> getMaxAge() {
        return Optional.ofNullable(maxAge);
    }

    /**
     * @return {@code true} if a series holding {@code size} samples exceeds the cap
     */
    boolean exceedsCount(int size) {
        return maxPoints > 0 && size > maxPoints;
    }

    /**
     * @return {@code true} if a sample taken at {@code timestamp} is too old
     *         relative to {@code now}
     */
    boolean isExpired(Instant timestamp, Instant now) {
        return maxAge != null && timestamp.isBefore(now.minus(maxAge));
    }

    private static int requirePositive(int maxPoints) {
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be > 0, got: " + maxPoints);
        }
        return maxPoints;
    }

    private static Duration requirePositive(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isZero() || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be positive, got: " + maxAge);
        }
        return maxAge;
    }

    @Override
    public String toString() {
        return "RetentionPolicy{" +
                "maxPoints=" + (maxPoints > 0 ? maxPoints : "unbounded") +
                ", maxAge=" + (maxAge != null ? maxAge : "unbounded") +
                '}';
    }
}
