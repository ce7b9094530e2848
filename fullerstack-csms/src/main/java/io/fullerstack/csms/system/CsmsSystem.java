package io.fullerstack.csms.system;

import io.fullerstack.csms.auth.AuthorizationCache;
import io.fullerstack.csms.config.CentralSystemConfig;
import io.fullerstack.csms.connection.ConnectionRegistry;
import io.fullerstack.csms.connection.LivenessMonitor;
import io.fullerstack.csms.ledger.TransactionLedger;
import io.fullerstack.csms.server.production.OcppJsonCentralSystem;
import io.fullerstack.csms.session.PendingCommands;
import io.fullerstack.csms.session.SessionCoordinator;
import io.fullerstack.csms.store.ChargingStore;
import io.fullerstack.csms.store.StorageReads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Complete central system: every component wired together once, for the lifetime of the process.
 * <pre>
 * Transport:   OcppJsonCentralSystem (WebSocket + JSON, OCPP 1.6)
 *              ↓ InboundMessage / ↑ InboundResponse
 * Coordinator: SessionCoordinator (per charge point exclusive section)
 *              ↓
 * State:       ConnectionRegistry, AuthorizationCache, TransactionLedger, PendingCommands
 *              ↓
 * Storage:     ChargingStore
 *
 * Background:  LivenessMonitor → SessionCoordinator.demoteIfIdle
 * </pre>
 */
public class CsmsSystem implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CsmsSystem.class);

    private final CentralSystemConfig config;

    // State
    private final ConnectionRegistry registry;
    private final AuthorizationCache authorizationCache;
    private final TransactionLedger ledger;
    private final PendingCommands pendingCommands;

    // Coordination
    private final SessionCoordinator coordinator;
    private final LivenessMonitor livenessMonitor;

    // Transport
    private final OcppJsonCentralSystem transport;

    private volatile boolean started;
    private volatile boolean stopped;

    public CsmsSystem(CentralSystemConfig config, ChargingStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        logger.info("Initializing central system: {}", config);

        StorageReads reads = new StorageReads(config.readRetryBackoff());
        this.registry = new ConnectionRegistry(clock);
        this.authorizationCache = new AuthorizationCache(store, reads, config.authCacheTtl(), clock);
        this.ledger = new TransactionLedger(store);
        this.pendingCommands = new PendingCommands(clock);

        this.coordinator = new SessionCoordinator(
            config, store, reads, authorizationCache, registry, ledger, pendingCommands, clock);

        this.livenessMonitor = new LivenessMonitor(
            registry, coordinator, clock, config.missedHeartbeatDeadline(), config.livenessCheckInterval());

        this.transport = new OcppJsonCentralSystem(coordinator, config);

        logger.info("Central system initialized");
    }

    /**
     * Restores active sessions from storage, then starts the liveness sweep and the transport.
     */
    public void start() {
        startCore();
        transport.start();
        logger.info("  - OCPP JSON server: {}:{}", config.host(), config.port());
    }

    /**
     * Everything except the transport.
     *
     * @throws IllegalStateException if the system was stopped; a stopped system is not restarted
     */
    public synchronized void startCore() {
        if (stopped) {
            throw new IllegalStateException("Central system was stopped and cannot be started again");
        }
        if (started) {
            logger.warn("Central system already started");
            return;
        }
        logger.info("Starting central system");

        int restored = ledger.recover();
        int online = coordinator.restoreOnlineChargePoints();
        livenessMonitor.start();
        started = true;

        logger.info("Central system started");
        logger.info("  - Active sessions restored: {}", restored);
        logger.info("  - Charge points awaiting traffic: {}", online);
        logger.info("  - Heartbeat interval: {} s, offline after {} s",
            config.heartbeatInterval().toSeconds(), config.missedHeartbeatDeadline().toSeconds());
    }

    /**
     * Stops the transport and the liveness sweep. Terminal: {@link #start()} is refused afterwards.
     */
    public synchronized void stop() {
        logger.info("Stopping central system");
        stopped = true;
        transport.stop();
        livenessMonitor.stop();
        started = false;
        logger.info("Central system stopped");
    }

    public boolean isStarted() {
        return started;
    }

    public SessionCoordinator getCoordinator() {
        return coordinator;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public TransactionLedger getLedger() {
        return ledger;
    }

    public AuthorizationCache getAuthorizationCache() {
        return authorizationCache;
    }

    public LivenessMonitor getLivenessMonitor() {
        return livenessMonitor;
    }

    public CentralSystemConfig getConfig() {
        return config;
    }

    @Override
    public synchronized void close() {
        logger.info("Closing central system");
        stopped = true;

        transport.close();
        livenessMonitor.close();
        pendingCommands.close();
        started = false;

        logger.info("Central system closed");
    }
}
