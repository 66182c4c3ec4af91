package org.omniroute.gig.engine.scheduler;

import org.omniroute.gig.engine.domain.service.AllocationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler for periodic maintenance sweeps.
 * Expires overdue offers and takes workers with stale heartbeats offline.
 */
public final class MaintenanceScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final AllocationService allocationService;
    private final int intervalSeconds;
    private final Duration heartbeatTimeout;
    private volatile boolean running = false;

    public MaintenanceScheduler(AllocationService allocationService, int intervalSeconds, Duration heartbeatTimeout) {
        this.allocationService = Objects.requireNonNull(allocationService, "allocationService must not be null");
        this.heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "maintenance-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            LOG.warn("Scheduler already running");
            return;
        }

        LOG.info("Starting maintenance scheduler with interval: {}s", intervalSeconds);

        executor.scheduleAtFixedRate(
                this::runSweep,
                intervalSeconds, // Initial delay
                intervalSeconds, // Period
                TimeUnit.SECONDS
        );

        running = true;
    }

    /**
     * Stop the scheduler.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping maintenance scheduler");
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run a single sweep. Each step is isolated so one failure does not skip the other.
     */
    void runSweep() {
        try {
            int expired = allocationService.expireStaleOffers();
            if (expired > 0) {
                LOG.info("Sweep expired {} offers", expired);
            }
        } catch (RuntimeException e) {
            LOG.error("Error in offer expiry sweep", e);
        }

        try {
            int offline = allocationService.markStaleWorkersOffline(heartbeatTimeout);
            if (offline > 0) {
                LOG.info("Sweep took {} silent workers offline", offline);
            }
        } catch (RuntimeException e) {
            LOG.error("Error in heartbeat sweep", e);
        }
    }
}
