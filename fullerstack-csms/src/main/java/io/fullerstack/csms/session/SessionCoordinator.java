package io.fullerstack.csms.session;

import io.fullerstack.csms.auth.AuthorizationCache;
import io.fullerstack.csms.config.CentralSystemConfig;
import io.fullerstack.csms.connection.ChargePointConnection;
import io.fullerstack.csms.connection.ConnectionRegistry;
import io.fullerstack.csms.connection.OfflineTransition;
import io.fullerstack.csms.ledger.StartOutcome;
import io.fullerstack.csms.ledger.StopOutcome;
import io.fullerstack.csms.ledger.TransactionLedger;
import io.fullerstack.csms.model.Availability;
import io.fullerstack.csms.model.ChargePoint;
import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.Connector;
import io.fullerstack.csms.model.DataTransfer;
import io.fullerstack.csms.model.MeterSample;
import io.fullerstack.csms.model.Reachability;
import io.fullerstack.csms.model.Verdict;
import io.fullerstack.csms.server.CommandReply;
import io.fullerstack.csms.server.InboundMessage;
import io.fullerstack.csms.server.InboundResponse;
import io.fullerstack.csms.server.OcppCommand;
import io.fullerstack.csms.store.ChargingStore;
import io.fullerstack.csms.store.StorageException;
import io.fullerstack.csms.store.StorageReads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Orchestrates connection registry, authorization cache and transaction ledger for every
 * inbound protocol message and every centrally-initiated command.
 * <p>
 * <b>Serialization:</b> all work on one charge point's state runs inside that charge point's
 * exclusive section ({@link ChargePointLocks}). Different charge points proceed in parallel.
 * Commands leave the section while they wait for the device, so a slow device never blocks
 * its own inbound traffic.
 * </p>
 * <p>
 * <b>Inbound flow:</b>
 * <pre>
 * transport → handle(message) → onXxx(...) → (AuthorizationCache | TransactionLedger) → ChargingStore
 *                                           ← InboundResponse
 * </pre>
 * Any inbound message counts as liveness and brings a demoted charge point back online.
 * </p>
 * <p>
 * <b>Command flow:</b>
 * <pre>
 * sendXxx(...) → validate → registry lookup (UNREACHABLE)
 *              → pending slot (BUSY) → connection.send → await reply (TIMEOUT)
 * </pre>
 * A remote stop never closes the session itself; the session ends when the device reports
 * its StopTransaction.
 * </p>
 */
public class SessionCoordinator implements OfflineTransition {
    private static final Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

    static final String DEFAULT_STOP_REASON = "Local";

    private final CentralSystemConfig config;
    private final ChargingStore store;
    private final StorageReads reads;
    private final AuthorizationCache authorizationCache;
    private final ConnectionRegistry registry;
    private final TransactionLedger ledger;
    private final PendingCommands pendingCommands;
    private final ChargePointLocks locks;
    private final Clock clock;

    public SessionCoordinator(
        CentralSystemConfig config,
        ChargingStore store,
        StorageReads reads,
        AuthorizationCache authorizationCache,
        ConnectionRegistry registry,
        TransactionLedger ledger,
        PendingCommands pendingCommands,
        Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.reads = Objects.requireNonNull(reads, "reads must not be null");
        this.authorizationCache = Objects.requireNonNull(authorizationCache, "authorizationCache must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.pendingCommands = Objects.requireNonNull(pendingCommands, "pendingCommands must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.locks = new ChargePointLocks();
    }

    // ========================================================================
    // Inbound dispatch
    // ========================================================================

    /**
     * Routes a decoded inbound message to its handler.
     *
     * @return the protocol-level answer for the message kind
     * @throws StorageException if a stop or meter sample write fails; the transport answers
     *                          with a protocol error so the device retries
     */
    @SuppressWarnings("unchecked")
    public <R extends InboundResponse> R handle(InboundMessage<R> message) {
        Objects.requireNonNull(message, "message must not be null");
        logger.debug("Inbound {} from {}", message.getClass().getSimpleName(), message.chargePointId());

        if (message instanceof InboundMessage.BootNotification boot) {
            return (R) onBoot(boot);
        } else if (message instanceof InboundMessage.Heartbeat heartbeat) {
            return (R) onHeartbeat(heartbeat);
        } else if (message instanceof InboundMessage.Authorize authorize) {
            return (R) onAuthorize(authorize);
        } else if (message instanceof InboundMessage.StatusNotification status) {
            return (R) onStatusNotification(status);
        } else if (message instanceof InboundMessage.StartTransaction start) {
            return (R) onStartTransaction(start);
        } else if (message instanceof InboundMessage.StopTransaction stop) {
            return (R) onStopTransaction(stop);
        } else if (message instanceof InboundMessage.MeterValues meterValues) {
            return (R) onMeterValues(meterValues);
        } else if (message instanceof InboundMessage.DataTransfer dataTransfer) {
            return (R) onDataTransfer(dataTransfer);
        }
        throw new IllegalArgumentException("Unhandled inbound message: " + message.getClass().getName());
    }

    // ========================================================================
    // Inbound messages
    // ========================================================================

    /**
     * BootNotification: upserts the charge point as online and returns the heartbeat interval.
     * Active sessions survive the reboot.
     */
    public InboundResponse.Boot onBoot(InboundMessage.BootNotification boot) {
        String chargePointId = boot.chargePointId();
        return locks.withLock(chargePointId, () -> {
            Instant now = clock.instant();
            registry.touch(chargePointId);
            int interval = (int) config.heartbeatInterval().toSeconds();

            try {
                ChargePoint record = reads.read("charge point " + chargePointId,
                        () -> store.findChargePoint(chargePointId))
                    .map(existing -> existing.rebooted(
                        boot.vendor(), boot.model(), boot.serialNumber(), boot.firmwareVersion(), now))
                    .orElseGet(() -> ChargePoint.booted(
                        chargePointId, boot.vendor(), boot.model(), boot.serialNumber(), boot.firmwareVersion(), now));
                store.upsertChargePoint(record);
            } catch (StorageException e) {
                logger.error("Could not record boot of {}, answering Pending: {}", chargePointId, e.getMessage());
                return new InboundResponse.Boot(InboundResponse.Registration.PENDING, now, interval);
            }

            List<ChargingSession> active = ledger.activeSessions(chargePointId);
            if (!active.isEmpty()) {
                logger.info("Charge point {} rebooted with {} active session(s), keeping them open",
                    chargePointId, active.size());
            }
            logger.info("Charge point {} booted ({} {}, firmware {})",
                chargePointId, boot.vendor(), boot.model(), boot.firmwareVersion());
            return new InboundResponse.Boot(InboundResponse.Registration.ACCEPTED, now, interval);
        });
    }

    public InboundResponse.Heartbeat onHeartbeat(InboundMessage.Heartbeat heartbeat) {
        String chargePointId = heartbeat.chargePointId();
        return locks.withLock(chargePointId, () -> {
            Instant now = clock.instant();
            registry.touch(chargePointId);
            persistReachability(chargePointId, Reachability.ONLINE, now);
            logger.trace("Heartbeat from {}", chargePointId);
            return new InboundResponse.Heartbeat(now);
        });
    }

    /**
     * Authorize: answers with the cached or freshly resolved verdict. A storage failure
     * answers INVALID.
     */
    public InboundResponse.Authorize onAuthorize(InboundMessage.Authorize authorize) {
        String chargePointId = authorize.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);
            Verdict verdict = resolveOrInvalid(authorize.idTag());
            logger.info("Authorize {} on {}: {}", authorize.idTag(), chargePointId, verdict);
            return new InboundResponse.Authorize(verdict);
        });
    }

    /**
     * StatusNotification: records the connector's reported status. Connector 0 describes the
     * charge point as a whole. Never rejected.
     */
    public InboundResponse.Acknowledged onStatusNotification(InboundMessage.StatusNotification notification) {
        String chargePointId = notification.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);
            Instant reportedAt = notification.timestamp() != null ? notification.timestamp() : clock.instant();

            try {
                if (notification.connectorId() == 0) {
                    reads.read("charge point " + chargePointId, () -> store.findChargePoint(chargePointId))
                        .ifPresentOrElse(
                            cp -> store.upsertChargePoint(cp.withStatus(notification.status())),
                            () -> logger.warn("Status {} for unknown charge point {}", notification.status(), chargePointId));
                } else {
                    Connector current = reads.read("connector " + chargePointId + "/" + notification.connectorId(),
                            () -> store.findConnector(chargePointId, notification.connectorId()))
                        .orElseGet(() -> new Connector(chargePointId, notification.connectorId(),
                            null, Availability.OPERATIVE, null, null, null));
                    Connector updated = current.withStatus(
                        notification.status(), notification.errorCode(), notification.info(), reportedAt);
                    if (notification.availability() != null) {
                        updated = updated.withAvailability(notification.availability());
                    }
                    store.upsertConnector(updated);
                }
            } catch (StorageException e) {
                logger.error("Could not record status {} of {} connector {}: {}",
                    notification.status(), chargePointId, notification.connectorId(), e.getMessage());
            }

            logger.info("Charge point {} connector {} is {} (error code {})",
                chargePointId, notification.connectorId(), notification.status(), notification.errorCode());
            return InboundResponse.Acknowledged.INSTANCE;
        });
    }

    /**
     * StartTransaction: verdict first, then the ledger's Idle to Active transition. No
     * transaction id is allocated unless both pass.
     */
    public InboundResponse.StartTransaction onStartTransaction(InboundMessage.StartTransaction start) {
        String chargePointId = start.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);

            Verdict verdict;
            try {
                verdict = authorizationCache.resolve(start.idTag());
            } catch (StorageException e) {
                logger.error("Rejecting start on {} connector {}: authorization lookup failed: {}",
                    chargePointId, start.connectorId(), e.getMessage());
                return InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.STORAGE_FAILURE, Verdict.INVALID);
            }
            if (!verdict.isAccepted()) {
                logger.warn("Rejecting start on {} connector {}: id tag {} is {}",
                    chargePointId, start.connectorId(), start.idTag(), verdict);
                return InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.UNAUTHORIZED, verdict);
            }

            Instant startedAt = start.timestamp() != null ? start.timestamp() : clock.instant();
            try {
                StartOutcome outcome = ledger.start(
                    chargePointId, start.connectorId(), start.idTag(), start.meterStart(), startedAt);
                if (!outcome.isStarted()) {
                    return InboundResponse.StartTransaction.rejected(
                        InboundResponse.StartTransaction.Outcome.CONCURRENT_TX, verdict);
                }
                return InboundResponse.StartTransaction.accepted(outcome.session().transactionId());
            } catch (StorageException e) {
                return InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.STORAGE_FAILURE, Verdict.INVALID);
            }
        });
    }

    /**
     * StopTransaction: the ledger's Active to Idle transition. Always acknowledged; a
     * transaction id without an active session is logged as NotFound and changes nothing.
     *
     * @throws StorageException if the completed session cannot be written; the session stays active
     */
    public InboundResponse.Acknowledged onStopTransaction(InboundMessage.StopTransaction stop) {
        String chargePointId = stop.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);
            Instant stoppedAt = stop.timestamp() != null ? stop.timestamp() : clock.instant();
            String reason = stop.reason() == null || stop.reason().isBlank() ? DEFAULT_STOP_REASON : stop.reason();

            StopOutcome outcome = ledger.stop(chargePointId, stop.transactionId(), stop.meterStop(), stoppedAt, reason);
            if (!outcome.isStopped()) {
                logger.warn("NotFound: StopTransaction {} from {} matches no active session, acknowledged anyway",
                    stop.transactionId(), chargePointId);
            }
            return InboundResponse.Acknowledged.INSTANCE;
        });
    }

    /**
     * MeterValues: the message's samples are persisted together, linked to the connector's
     * active session or flagged as orphaned. A failed write stores none of them, so the
     * charge point's retry of the same message does not duplicate samples.
     *
     * @throws StorageException if the samples cannot be written
     */
    public InboundResponse.Acknowledged onMeterValues(InboundMessage.MeterValues meterValues) {
        String chargePointId = meterValues.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);
            Instant now = clock.instant();

            List<MeterSample> samples = meterValues.samples().stream()
                .map(sampled -> new MeterSample(
                    null,
                    chargePointId,
                    meterValues.connectorId(),
                    sampled.timestamp() != null ? sampled.timestamp() : now,
                    sampled.value(),
                    sampled.measurand() != null ? sampled.measurand() : MeterSample.DEFAULT_MEASURAND,
                    sampled.unit() != null ? sampled.unit() : MeterSample.DEFAULT_UNIT))
                .collect(Collectors.toList());
            ledger.recordSamples(samples, meterValues.transactionId());

            logger.debug("Recorded {} meter sample(s) from {} connector {}",
                samples.size(), chargePointId, meterValues.connectorId());
            return InboundResponse.Acknowledged.INSTANCE;
        });
    }

    /**
     * DataTransfer: vendor payload stored as is, always accepted.
     */
    public InboundResponse.Acknowledged onDataTransfer(InboundMessage.DataTransfer dataTransfer) {
        String chargePointId = dataTransfer.chargePointId();
        return locks.withLock(chargePointId, () -> {
            markSeen(chargePointId);
            try {
                store.appendDataTransfer(new DataTransfer(chargePointId, dataTransfer.vendorId(),
                    dataTransfer.messageId(), dataTransfer.data(), clock.instant()));
            } catch (StorageException e) {
                logger.error("Could not store DataTransfer {}/{} from {}: {}",
                    dataTransfer.vendorId(), dataTransfer.messageId(), chargePointId, e.getMessage());
            }
            logger.info("DataTransfer from {} (vendor {}, message {})",
                chargePointId, dataTransfer.vendorId(), dataTransfer.messageId());
            return InboundResponse.Acknowledged.INSTANCE;
        });
    }

    // ========================================================================
    // Connection lifecycle
    // ========================================================================

    /**
     * A new connection was opened by the charge point. Any older handle is closed.
     */
    public void onConnect(String chargePointId, ChargePointConnection connection) {
        locks.withLock(chargePointId, () -> {
            registry.register(chargePointId, connection);
            persistReachability(chargePointId, Reachability.ONLINE, clock.instant());
        });
    }

    /**
     * Hands every charge point that storage still reports as online to the liveness sweep,
     * measured from its stored last activity. Run once at startup, before any connection
     * is accepted.
     *
     * @return number of charge points restored
     */
    public int restoreOnlineChargePoints() {
        Instant now = clock.instant();
        int restored = 0;
        for (ChargePoint chargePoint : reads.read("all charge points", store::findAllChargePoints)) {
            if (!chargePoint.isOnline()) {
                continue;
            }
            Instant lastSeen = chargePoint.lastSeen() != null ? chargePoint.lastSeen() : now;
            if (registry.restore(chargePoint.chargePointId(), lastSeen)) {
                restored++;
                logger.debug("Charge point {} stored as online, last seen {}", chargePoint.chargePointId(), lastSeen);
            }
        }
        logger.info("Restored {} charge point(s) stored as online", restored);
        return restored;
    }

    /**
     * The transport lost a connection. Ignored if the handle was already superseded.
     * Active sessions stay active.
     */
    public void onDisconnect(String chargePointId, ChargePointConnection connection) {
        locks.withLock(chargePointId, () -> {
            if (!registry.unregister(chargePointId, connection)) {
                return;
            }
            persistReachability(chargePointId, Reachability.OFFLINE, clock.instant());
            int active = ledger.activeSessions(chargePointId).size();
            logger.info("Charge point {} disconnected ({} active session(s) kept)", chargePointId, active);
        });
    }

    /**
     * Liveness demotion. Rechecks the deadline inside the charge point's exclusive section so
     * traffic that arrived after the sweep looked keeps the charge point online.
     */
    @Override
    public boolean demoteIfIdle(String chargePointId, Instant now) {
        return locks.withLock(chargePointId, () -> {
            Optional<Instant> lastActivity = registry.lastActivity(chargePointId);
            if (lastActivity.isEmpty()) {
                return false;
            }
            if (Duration.between(lastActivity.get(), now).compareTo(config.missedHeartbeatDeadline()) <= 0) {
                logger.debug("Charge point {} active again, not demoting", chargePointId);
                return false;
            }

            registry.evict(chargePointId).ifPresent(ChargePointConnection::close);
            persistReachability(chargePointId, Reachability.OFFLINE, now);
            logger.warn("Charge point {} demoted to offline (last activity {})", chargePointId, lastActivity.get());
            return true;
        });
    }

    // ========================================================================
    // Centrally-initiated commands
    // ========================================================================

    /**
     * Asks the charge point to start a transaction for the tag. The tag must resolve to
     * ACCEPTED and the connector, if given, must be idle; otherwise nothing is sent.
     */
    public CommandResult sendRemoteStart(String chargePointId, String idTag, Integer connectorId) {
        Objects.requireNonNull(idTag, "idTag must not be null");

        Verdict verdict;
        try {
            verdict = authorizationCache.resolve(idTag);
        } catch (StorageException e) {
            logger.error("Remote start on {} not sent: authorization lookup failed: {}", chargePointId, e.getMessage());
            return CommandResult.notSent(CommandStatus.FAILED, "authorization lookup failed");
        }
        if (!verdict.isAccepted()) {
            logger.warn("Remote start on {} not sent: id tag {} is {}", chargePointId, idTag, verdict);
            return CommandResult.notSent(CommandStatus.REJECTED, "id tag " + idTag + " is " + verdict);
        }

        if (connectorId != null) {
            Optional<ChargingSession> active = ledger.activeSession(chargePointId, connectorId);
            if (active.isPresent()) {
                logger.warn("Remote start on {} not sent: connector {} busy with transaction {}",
                    chargePointId, connectorId, active.get().transactionId());
                return CommandResult.notSent(CommandStatus.REJECTED,
                    "connector " + connectorId + " has active transaction " + active.get().transactionId());
            }
        }

        return dispatch(new OcppCommand.RemoteStartTransaction(chargePointId, newCommandId(), connectorId, idTag));
    }

    /**
     * Asks the charge point to stop a transaction. An accepted reply does not close the
     * session: that happens when the device reports its StopTransaction.
     */
    public CommandResult sendRemoteStop(String chargePointId, int transactionId) {
        Optional<ChargingSession> session;
        try {
            session = reads.read("session " + transactionId, () -> store.findSession(transactionId));
        } catch (StorageException e) {
            logger.error("Remote stop of {} on {} not sent: {}", transactionId, chargePointId, e.getMessage());
            return CommandResult.notSent(CommandStatus.FAILED, "session lookup failed");
        }

        if (session.isEmpty() || !session.get().chargePointId().equals(chargePointId)) {
            logger.warn("NotFound: remote stop of transaction {} on {}", transactionId, chargePointId);
            return CommandResult.notSent(CommandStatus.NOT_FOUND,
                "transaction " + transactionId + " not found on " + chargePointId);
        }
        if (!session.get().isActive()) {
            logger.warn("NotFound: remote stop of transaction {} on {}, not active", transactionId, chargePointId);
            return CommandResult.notSent(CommandStatus.NOT_FOUND, "transaction " + transactionId + " is not active");
        }

        CommandResult result = dispatch(new OcppCommand.RemoteStopTransaction(chargePointId, newCommandId(), transactionId));
        if (result.isAccepted()) {
            logger.info("Remote stop of transaction {} accepted by {}, awaiting its StopTransaction",
                transactionId, chargePointId);
        }
        return result;
    }

    /**
     * Changes the availability of one connector, or of all known connectors for connector 0.
     * The stored availability follows only an ACCEPTED reply.
     */
    public CommandResult sendChangeAvailability(String chargePointId, int connectorId, Availability availability) {
        Objects.requireNonNull(availability, "availability must not be null");
        if (connectorId < 0) {
            return CommandResult.notSent(CommandStatus.REJECTED, "connector id must not be negative");
        }

        CommandResult result = dispatch(
            new OcppCommand.ChangeAvailability(chargePointId, newCommandId(), connectorId, availability));
        if (!result.isAccepted()) {
            return result;
        }

        return locks.withLock(chargePointId, () -> {
            try {
                applyAvailability(chargePointId, connectorId, availability);
                return result;
            } catch (StorageException e) {
                logger.error("{} accepted ChangeAvailability but it could not be stored: {}",
                    chargePointId, e.getMessage());
                return new CommandResult(result.status(), result.commandId(), "availability not stored");
            }
        });
    }

    public CommandResult sendReset(String chargePointId, OcppCommand.Reset.Type type) {
        Objects.requireNonNull(type, "type must not be null");
        return dispatch(new OcppCommand.Reset(chargePointId, newCommandId(), type));
    }

    /**
     * Changes one configuration key on the charge point. Accepted values (including
     * RebootRequired) are stored under {@code chargePointId/key}.
     */
    public CommandResult sendChangeConfiguration(String chargePointId, String key, String value) {
        if (key == null || key.isBlank()) {
            return CommandResult.notSent(CommandStatus.REJECTED, "configuration key must not be blank");
        }
        if (value == null) {
            return CommandResult.notSent(CommandStatus.REJECTED, "configuration value must not be null");
        }

        CommandResult result = dispatch(new OcppCommand.ChangeConfiguration(chargePointId, newCommandId(), key, value));
        if (result.status() == CommandStatus.ACCEPTED || result.status() == CommandStatus.REBOOT_REQUIRED) {
            try {
                store.putConfiguration(chargePointId + "/" + key, value);
            } catch (StorageException e) {
                logger.error("{} accepted {}={} but it could not be stored: {}", chargePointId, key, value, e.getMessage());
                return new CommandResult(result.status(), result.commandId(), "configuration not stored");
            }
        }
        return result;
    }

    /**
     * Clears the central authorization cache and, when a charge point id is given, the
     * charge point's local cache as well.
     *
     * @param chargePointId charge point to send ClearCache to, or null for the central cache only
     */
    public CommandResult clearAuthorizationCache(String chargePointId) {
        authorizationCache.invalidateAll();
        if (chargePointId == null) {
            return CommandResult.notSent(CommandStatus.ACCEPTED, "central cache cleared");
        }
        return dispatch(new OcppCommand.ClearCache(chargePointId, newCommandId()));
    }

    // ========================================================================
    // Administrative read path
    // ========================================================================

    public Optional<ChargePointSnapshot> chargePointStatus(String chargePointId) {
        return reads.read("charge point " + chargePointId, () -> store.findChargePoint(chargePointId))
            .map(chargePoint -> new ChargePointSnapshot(
                chargePoint,
                registry.isConnected(chargePointId),
                registry.lastActivity(chargePointId).orElse(null),
                reads.read("connectors of " + chargePointId, () -> store.findConnectors(chargePointId)).stream()
                    .sorted(Comparator.comparingInt(Connector::connectorId))
                    .collect(Collectors.toList()),
                ledger.activeSessions(chargePointId)
            ));
    }

    public List<ChargePoint> allChargePoints() {
        return reads.read("all charge points", store::findAllChargePoints);
    }

    public List<ChargingSession> activeSessions() {
        return ledger.activeSessions();
    }

    public List<ChargingSession> sessionHistory(String chargePointId) {
        return reads.read("sessions of " + chargePointId, () -> store.findSessions(chargePointId));
    }

    public List<MeterSample> meterSamples(int transactionId) {
        return reads.read("meter samples of " + transactionId, () -> store.findMeterSamples(transactionId));
    }

    public List<MeterSample> orphanedSamples(String chargePointId) {
        return reads.read("orphaned samples of " + chargePointId, () -> store.findOrphanedMeterSamples(chargePointId));
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private CommandResult dispatch(OcppCommand command) {
        String chargePointId = command.chargePointId();
        String commandType = command.getClass().getSimpleName();

        Optional<ChargePointConnection> connection = registry.lookup(chargePointId);
        if (connection.isEmpty()) {
            logger.warn("{} not sent: charge point {} is not connected", commandType, chargePointId);
            return CommandResult.notSent(CommandStatus.UNREACHABLE, chargePointId + " is not connected");
        }

        Optional<CompletableFuture<CommandReply>> reply = pendingCommands.register(command, config.commandTimeout());
        if (reply.isEmpty()) {
            return CommandResult.notSent(CommandStatus.BUSY, "another command to " + chargePointId + " is pending");
        }

        try {
            connection.get().send(command).whenComplete((answer, error) -> {
                if (error != null) {
                    pendingCommands.fail(command.commandId(), error);
                } else {
                    pendingCommands.complete(answer);
                }
            });
        } catch (RuntimeException e) {
            pendingCommands.fail(command.commandId(), e);
        }

        logger.info("Sent {} {} to {}", commandType, command.commandId(), chargePointId);
        return await(command, reply.get());
    }

    private CommandResult await(OcppCommand command, CompletableFuture<CommandReply> reply) {
        String commandId = command.commandId();
        try {
            CommandReply answer = reply.get();
            CommandStatus status = CommandStatus.fromReply(answer.status());
            if (status == CommandStatus.FAILED) {
                logger.warn("Unrecognised reply '{}' to command {}", answer.status(), commandId);
            }
            return CommandResult.replied(commandId, status);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                return new CommandResult(CommandStatus.TIMEOUT, commandId, cause.getMessage());
            }
            return new CommandResult(CommandStatus.FAILED, commandId, String.valueOf(cause.getMessage()));
        } catch (CancellationException e) {
            return new CommandResult(CommandStatus.FAILED, commandId, "cancelled: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pendingCommands.fail(commandId, e);
            return new CommandResult(CommandStatus.FAILED, commandId, "interrupted while awaiting reply");
        }
    }

    private void applyAvailability(String chargePointId, int connectorId, Availability availability) {
        if (connectorId == 0) {
            List<Connector> connectors = reads.read("connectors of " + chargePointId,
                () -> store.findConnectors(chargePointId));
            for (Connector connector : connectors) {
                store.upsertConnector(connector.withAvailability(availability));
            }
            logger.info("Charge point {} set {} on {} connector(s)", chargePointId, availability, connectors.size());
            return;
        }

        Connector connector = reads.read("connector " + chargePointId + "/" + connectorId,
                () -> store.findConnector(chargePointId, connectorId))
            .orElseGet(() -> new Connector(chargePointId, connectorId, null, availability, null, null, null));
        store.upsertConnector(connector.withAvailability(availability));
        logger.info("Charge point {} connector {} set {}", chargePointId, connectorId, availability);
    }

    /**
     * Counts any inbound traffic as liveness; a charge point without a registry entry comes
     * back online.
     */
    private void markSeen(String chargePointId) {
        if (!registry.touch(chargePointId)) {
            logger.info("Charge point {} back online", chargePointId);
            persistReachability(chargePointId, Reachability.ONLINE, clock.instant());
        }
    }

    private void persistReachability(String chargePointId, Reachability reachability, Instant at) {
        try {
            store.updateReachability(chargePointId, reachability, at);
        } catch (StorageException e) {
            logger.error("Could not store {} reachability of {}: {}", reachability, chargePointId, e.getMessage());
        }
    }

    private Verdict resolveOrInvalid(String idTag) {
        try {
            return authorizationCache.resolve(idTag);
        } catch (StorageException e) {
            logger.error("Authorization lookup for {} failed, answering Invalid: {}", idTag, e.getMessage());
            return Verdict.INVALID;
        }
    }

    private static String newCommandId() {
        return UUID.randomUUID().toString();
    }
}
