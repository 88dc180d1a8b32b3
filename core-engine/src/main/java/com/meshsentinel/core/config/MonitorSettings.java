package com.meshsentinel.core.config;

import com.meshsentinel.core.store.RetentionPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Polling-loop and retention settings.
 *
 * @since 1.0.0
 */
public class MonitorSettings {

    /** Seconds between two polling ticks. */
    private long intervalSeconds = 30;

    /** Samples of the primary metric read per entity on each tick. */
    private int historySize = 50;

    /** Ticks spent learning baselines before switching to detection. */
    private int learningTicks = 20;

    /** Samples kept per series; 0 keeps everything. */
    private int retentionMaxPoints;

    /** Maximum sample age in seconds; 0 disables the age limit. */
    private long retentionMaxAgeSeconds;

    void collectErrors(List<String> errors) {
        if (intervalSeconds < 1) {
            errors.add("monitor.intervalSeconds must be >= 1, got: " + intervalSeconds);
        }
        if (historySize < 1) {
            errors.add("monitor.historySize must be >= 1, got: " + historySize);
        }
        if (learningTicks < 0) {
            errors.add("monitor.learningTicks must be >= 0, got: " + learningTicks);
        }
        if (retentionMaxPoints < 0) {
            errors.add("monitor.retentionMaxPoints must be >= 0, got: " + retentionMaxPoints);
        }
        if (retentionMaxAgeSeconds < 0) {
            errors.add("monitor.retentionMaxAgeSeconds must be >= 0, got: " + retentionMaxAgeSeconds);
        }
    }

    /**
     * @return the store retention described by the two retention settings
     */
    public RetentionPolicy toRetentionPolicy() {
        RetentionPolicy policy = RetentionPolicy.unbounded();
        if (retentionMaxPoints > 0) {
            policy = policy.withMaxPoints(retentionMaxPoints);
        }
        if (retentionMaxAgeSeconds > 0) {
            policy = policy.withMaxAge(Duration.ofSeconds(retentionMaxAgeSeconds));
        }
        return policy;
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getLearningTicks() {
        return learningTicks;
    }

    public void setLearningTicks(int learningTicks) {
        this.learningTicks = learningTicks;
    }

    public int getRetentionMaxPoints() {
        return retentionMaxPoints;
    }

    public void setRetentionMaxPoints(int retentionMaxPoints) {
        this.retentionMaxPoints = retentionMaxPoints;
    }

    public long getRetentionMaxAgeSeconds() {
        return retentionMaxAgeSeconds;
    }

    public void setRetentionMaxAgeSeconds(long retentionMaxAgeSeconds) {
        this.retentionMaxAgeSeconds = retentionMaxAgeSeconds;
    }

    @Override
    public String toString() {
        return "MonitorSettings{" +
                "intervalSeconds=" + intervalSeconds +
                ", historySize=" + historySize +
                ", learningTicks=" + learningTicks +
                ", retentionMaxPoints=" + retentionMaxPoints +
                ", retentionMaxAgeSeconds=" + retentionMaxAgeSeconds +
                '}';
    }
}
