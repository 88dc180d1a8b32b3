package com.meshsentinel.monitor;

import com.meshsentinel.monitor.output.AnomalyRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a {@link MeshScanner} tick by tick.
 *
 * <p>
 * The first {@code learningTicks} ticks learn baselines; every later tick
 * detects. Detection ticks print their anomalies through the configured
 * {@link AnomalyRenderer}; quiet ticks print nothing unless {@code verbose}.
 * </p>
 *
 * <h3>Scheduling</h3>
 * <p>
 * {@link #start()} runs ticks on a single thread at a fixed delay, so ticks
 * never overlap. A tick that throws is logged and the schedule carries on.
 * {@link #runScan()} runs the same ticks back to back on the calling thread.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorLoop {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorLoop.class);

    private final MeshScanner scanner;
    private final AnomalyRenderer renderer;
    private final PrintStream out;
    private final long intervalSeconds;
    private final int learningTicks;
    private final boolean verbose;
    private final AtomicLong completedTicks = new AtomicLong();

    private ScheduledExecutorService executor;

    /**
     * @param scanner         scanner run on every tick
     * @param renderer        renders detected anomalies
     * @param out             where rendered output goes
     * @param intervalSeconds delay between ticks in {@link #start()} mode
     * @param learningTicks   ticks spent learning before detection starts
     * @param verbose         also print ticks without anomalies
     */
    public MonitorLoop(MeshScanner scanner,
            AnomalyRenderer renderer,
            PrintStream out,
            long intervalSeconds,
            int learningTicks,
            boolean verbose) {
        this.scanner = Objects.requireNonNull(scanner, "MeshScanner must not be null");
        this.renderer = Objects.requireNonNull(renderer, "AnomalyRenderer must not be null");
        this.out = Objects.requireNonNull(out, "PrintStream must not be null");
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be >= 1, got: " + intervalSeconds);
        }
        if (learningTicks < 0) {
            throw new IllegalArgumentException("learningTicks must be >= 0, got: " + learningTicks);
        }
        this.intervalSeconds = intervalSeconds;
        this.learningTicks = learningTicks;
        this.verbose = verbose;
    }

    // ---------------------------------------------------------------
    // Ticks
    // ---------------------------------------------------------------

    /**
     * Run one tick in whichever phase the loop is in.
     *
     * @return the tick's report
     */
    public ScanReport tick() {
        ScanPhase phase = currentPhase();
        ScanReport report = scanner.scan(phase);
        long done = completedTicks.incrementAndGet();

        if (phase == ScanPhase.LEARN) {
            LOG.info("Learning tick {}/{}: {} baseline(s) learned, {} failed collection(s)",
                    done, learningTicks, report.getLearned().size(), report.getFailed().size());
            if (done == learningTicks) {
                LOG.info("Learning finished; {} entit(ies) have a baseline",
                        scanner.getDetector().getRegistry().size());
            }
        } else {
            print(report, verbose);
        }
        return report;
    }

    /**
     * Run every learning tick and then one detection tick, printing the
     * detection result even when it is empty.
     *
     * @return the detection tick's report
     */
    public ScanReport runScan() {
        while (currentPhase() == ScanPhase.LEARN) {
            tick();
        }
        ScanReport report = scanner.scan(ScanPhase.DETECT);
        completedTicks.incrementAndGet();
        print(report, true);
        return report;
    }

    public ScanPhase currentPhase() {
        return completedTicks.get() < learningTicks ? ScanPhase.LEARN : ScanPhase.DETECT;
    }

    public long getCompletedTicks() {
        return completedTicks.get();
    }

    public MeshScanner getScanner() {
        return scanner;
    }

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------

    /**
     * Start ticking every {@code intervalSeconds} on a background thread.
     *
     * @throws IllegalStateException if the loop is already running
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Monitor loop already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "mesh-monitor"));
        executor.scheduleWithFixedDelay(this::safeTick, 0, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("Monitor loop started: interval={}s, learningTicks={}", intervalSeconds, learningTicks);
    }

    /**
     * Stop ticking and wait briefly for a running tick to finish.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Monitor loop stopped after {} tick(s)", completedTicks.get());
    }

    /**
     * Block until the loop has been stopped.
     */
    public void awaitTermination() throws InterruptedException {
        ScheduledExecutorService running;
        synchronized (this) {
            running = executor;
        }
        if (running != null) {
            while (!running.awaitTermination(1, TimeUnit.MINUTES)) {
                LOG.trace("Monitor loop still running");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Monitor tick failed: {}", e.getMessage(), e);
        }
    }

    private void print(ScanReport report, boolean evenIfEmpty) {
        if (report.getAnomalies().isEmpty() && !evenIfEmpty) {
            LOG.debug("No anomalies this tick");
            return;
        }
        out.print(renderer.render(report.getAnomalies()));
        out.flush();
    }
}
