package io.fullerstack.csms.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically demotes charge points that stopped sending traffic.
 * <p>
 * On every tick, each online charge point whose last activity is older than the
 * missed-heartbeat deadline is handed to the {@link OfflineTransition}. This monitor never
 * promotes a charge point back to online; any inbound message does that.
 * </p>
 */
public class LivenessMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LivenessMonitor.class);

    private final ConnectionRegistry registry;
    private final OfflineTransition transition;
    private final Clock clock;
    private final Duration missedHeartbeatDeadline;
    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweep;
    private volatile boolean running;

    public LivenessMonitor(
        ConnectionRegistry registry,
        OfflineTransition transition,
        Clock clock,
        Duration missedHeartbeatDeadline,
        Duration checkInterval
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.transition = Objects.requireNonNull(transition, "transition must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.missedHeartbeatDeadline = Objects.requireNonNull(missedHeartbeatDeadline);
        this.checkInterval = Objects.requireNonNull(checkInterval);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "liveness-monitor");
            t.setDaemon(true);
            return t;
        });
        this.running = false;
    }

    /**
     * Start the periodic sweep. A stopped monitor can be started again until it is closed.
     */
    public synchronized void start() {
        if (running) {
            logger.warn("LivenessMonitor already running");
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("LivenessMonitor is closed");
        }

        logger.info("Starting LivenessMonitor (deadline {} s, every {} s)",
            missedHeartbeatDeadline.toSeconds(), checkInterval.toSeconds());
        running = true;

        sweep = scheduler.scheduleAtFixedRate(
            this::safeTick,
            checkInterval.toMillis(),
            checkInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the sweep.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        logger.info("Stopping LivenessMonitor");
        running = false;
        sweep.cancel(false);
        sweep = null;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one sweep.
     *
     * @return number of charge points demoted
     */
    public int tick() {
        Instant now = clock.instant();
        int demoted = 0;

        for (String chargePointId : registry.onlineChargePoints()) {
            Optional<Instant> lastActivity = registry.lastActivity(chargePointId);
            if (lastActivity.isEmpty() || !isOverdue(lastActivity.get(), now)) {
                continue;
            }
            logger.warn("Charge point {} silent since {} (deadline {} s)",
                chargePointId, lastActivity.get(), missedHeartbeatDeadline.toSeconds());
            if (transition.demoteIfIdle(chargePointId, now)) {
                demoted++;
            }
        }

        if (demoted > 0) {
            logger.info("Liveness sweep demoted {} charge point(s) to offline", demoted);
        }
        return demoted;
    }

    public boolean isOverdue(Instant lastActivity, Instant now) {
        return Duration.between(lastActivity, now).compareTo(missedHeartbeatDeadline) > 0;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.error("Error during liveness sweep", e);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
