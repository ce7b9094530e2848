package io.fullerstack.csms.server.production;

import eu.chargetime.ocpp.JSONServer;
import eu.chargetime.ocpp.ServerEvents;
import eu.chargetime.ocpp.feature.profile.ServerCoreEventHandler;
import eu.chargetime.ocpp.feature.profile.ServerCoreProfile;
import eu.chargetime.ocpp.model.Confirmation;
import eu.chargetime.ocpp.model.Request;
import eu.chargetime.ocpp.model.SessionInformation;
import eu.chargetime.ocpp.model.core.AuthorizationStatus;
import eu.chargetime.ocpp.model.core.AuthorizeConfirmation;
import eu.chargetime.ocpp.model.core.AuthorizeRequest;
import eu.chargetime.ocpp.model.core.AvailabilityType;
import eu.chargetime.ocpp.model.core.BootNotificationConfirmation;
import eu.chargetime.ocpp.model.core.BootNotificationRequest;
import eu.chargetime.ocpp.model.core.ChangeAvailabilityConfirmation;
import eu.chargetime.ocpp.model.core.ChangeAvailabilityRequest;
import eu.chargetime.ocpp.model.core.ChangeConfigurationConfirmation;
import eu.chargetime.ocpp.model.core.ChangeConfigurationRequest;
import eu.chargetime.ocpp.model.core.ClearCacheConfirmation;
import eu.chargetime.ocpp.model.core.ClearCacheRequest;
import eu.chargetime.ocpp.model.core.DataTransferConfirmation;
import eu.chargetime.ocpp.model.core.DataTransferRequest;
import eu.chargetime.ocpp.model.core.DataTransferStatus;
import eu.chargetime.ocpp.model.core.HeartbeatConfirmation;
import eu.chargetime.ocpp.model.core.HeartbeatRequest;
import eu.chargetime.ocpp.model.core.IdTagInfo;
import eu.chargetime.ocpp.model.core.MeterValue;
import eu.chargetime.ocpp.model.core.MeterValuesConfirmation;
import eu.chargetime.ocpp.model.core.MeterValuesRequest;
import eu.chargetime.ocpp.model.core.RegistrationStatus;
import eu.chargetime.ocpp.model.core.RemoteStartTransactionConfirmation;
import eu.chargetime.ocpp.model.core.RemoteStartTransactionRequest;
import eu.chargetime.ocpp.model.core.RemoteStopTransactionConfirmation;
import eu.chargetime.ocpp.model.core.RemoteStopTransactionRequest;
import eu.chargetime.ocpp.model.core.ResetConfirmation;
import eu.chargetime.ocpp.model.core.ResetRequest;
import eu.chargetime.ocpp.model.core.ResetType;
import eu.chargetime.ocpp.model.core.SampledValue;
import eu.chargetime.ocpp.model.core.StartTransactionConfirmation;
import eu.chargetime.ocpp.model.core.StartTransactionRequest;
import eu.chargetime.ocpp.model.core.StatusNotificationConfirmation;
import eu.chargetime.ocpp.model.core.StatusNotificationRequest;
import eu.chargetime.ocpp.model.core.StopTransactionConfirmation;
import eu.chargetime.ocpp.model.core.StopTransactionRequest;
import io.fullerstack.csms.config.CentralSystemConfig;
import io.fullerstack.csms.connection.ChargePointConnection;
import io.fullerstack.csms.model.Availability;
import io.fullerstack.csms.model.ConnectorStatus;
import io.fullerstack.csms.model.Verdict;
import io.fullerstack.csms.server.CommandReply;
import io.fullerstack.csms.server.InboundMessage;
import io.fullerstack.csms.server.InboundResponse;
import io.fullerstack.csms.server.OcppCommand;
import io.fullerstack.csms.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Production OCPP 1.6 JSON transport using the ChargeTimeEU library.
 * <p>
 * This implementation:
 * - Uses JSONServer with WebSocket transport
 * - Translates each core profile request into an {@link InboundMessage} and hands it to the
 *   {@link SessionCoordinator}
 * - Translates the coordinator's {@link InboundResponse} back into the library's confirmation
 * - Registers a {@link ChargePointConnection} per WebSocket session and reports lost sessions
 * </p>
 * <p>
 * Request/reply correlation of outbound commands is done by the library; each send yields
 * the confirmation of exactly that request.
 * </p>
 */
public class OcppJsonCentralSystem implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OcppJsonCentralSystem.class);

    private final SessionCoordinator coordinator;
    private final CentralSystemConfig config;
    private final JSONServer server;
    private final Map<UUID, JsonChargePointConnection> sessions;  // sessionId -> connection
    private volatile boolean running;

    public OcppJsonCentralSystem(SessionCoordinator coordinator, CentralSystemConfig config) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sessions = new ConcurrentHashMap<>();
        this.server = new JSONServer(new ServerCoreProfile(new CoreEventHandler()));
        this.running = false;
    }

    /**
     * Opens the listening socket.
     */
    public void start() {
        if (running) {
            logger.warn("OCPP JSON server already running");
            return;
        }

        server.open(config.host(), config.port(), new ServerEventHandler());
        running = true;
        logger.info("OCPP 1.6 JSON server listening on {}:{}", config.host(), config.port());
    }

    /**
     * Closes the listening socket and every session.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        server.close();
        logger.info("OCPP 1.6 JSON server stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @Override
    public void close() {
        stop();
    }

    // ========================================================================
    // Translation: library requests → inbound messages
    // ========================================================================

    static InboundMessage.BootNotification toBootNotification(String chargePointId, BootNotificationRequest request) {
        return new InboundMessage.BootNotification(
            chargePointId,
            request.getChargePointVendor(),
            request.getChargePointModel(),
            request.getChargePointSerialNumber(),
            request.getFirmwareVersion()
        );
    }

    /**
     * Unavailable implies Inoperative; any other status implies Operative.
     */
    static InboundMessage.StatusNotification toStatusNotification(String chargePointId, StatusNotificationRequest request) {
        ConnectorStatus status = ConnectorStatus.fromOcpp(String.valueOf(request.getStatus()));
        Availability availability = status == ConnectorStatus.UNAVAILABLE ? Availability.INOPERATIVE : Availability.OPERATIVE;
        return new InboundMessage.StatusNotification(
            chargePointId,
            request.getConnectorId(),
            status,
            availability,
            Objects.toString(request.getErrorCode(), null),
            request.getInfo(),
            toInstant(request.getTimestamp())
        );
    }

    static InboundMessage.StartTransaction toStartTransaction(String chargePointId, StartTransactionRequest request) {
        return new InboundMessage.StartTransaction(
            chargePointId,
            request.getConnectorId(),
            request.getIdTag(),
            request.getMeterStart(),
            toInstant(request.getTimestamp())
        );
    }

    static InboundMessage.StopTransaction toStopTransaction(String chargePointId, StopTransactionRequest request) {
        return new InboundMessage.StopTransaction(
            chargePointId,
            request.getTransactionId(),
            request.getIdTag(),
            request.getMeterStop(),
            toInstant(request.getTimestamp()),
            Objects.toString(request.getReason(), null)
        );
    }

    /**
     * Flattens every sampled value of every meter value; a sampled value inherits the
     * timestamp of its meter value. A value that is not a finite number is logged and
     * skipped, the rest of the message is kept.
     */
    static InboundMessage.MeterValues toMeterValues(String chargePointId, MeterValuesRequest request) {
        List<InboundMessage.SampledValue> samples = new ArrayList<>();
        if (request.getMeterValue() != null) {
            for (MeterValue meterValue : request.getMeterValue()) {
                if (meterValue.getSampledValue() == null) {
                    continue;
                }
                Instant timestamp = toInstant(meterValue.getTimestamp());
                for (SampledValue sampledValue : meterValue.getSampledValue()) {
                    OptionalDouble value = parseSample(sampledValue.getValue());
                    if (value.isEmpty()) {
                        logger.warn("Skipping non-numeric sampled value '{}' ({}) from {} connector {}",
                            sampledValue.getValue(), sampledValue.getMeasurand(), chargePointId, request.getConnectorId());
                        continue;
                    }
                    samples.add(new InboundMessage.SampledValue(
                        timestamp,
                        value.getAsDouble(),
                        Objects.toString(sampledValue.getMeasurand(), null),
                        Objects.toString(sampledValue.getUnit(), null)
                    ));
                }
            }
        }
        return new InboundMessage.MeterValues(
            chargePointId,
            request.getConnectorId(),
            request.getTransactionId(),
            samples
        );
    }

    private static OptionalDouble parseSample(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    // ========================================================================
    // Translation: inbound responses → library confirmations
    // ========================================================================

    static BootNotificationConfirmation toConfirmation(InboundResponse.Boot boot) {
        BootNotificationConfirmation confirmation = new BootNotificationConfirmation();
        confirmation.setCurrentTime(toZoned(boot.currentTime()));
        confirmation.setInterval(boot.heartbeatIntervalSeconds());
        confirmation.setStatus(boot.status() == InboundResponse.Registration.ACCEPTED
            ? RegistrationStatus.Accepted
            : RegistrationStatus.Pending);
        return confirmation;
    }

    /**
     * Rejections carry transaction id 0; CONCURRENT_TX maps to ConcurrentTx and a storage
     * failure to Invalid.
     */
    static StartTransactionConfirmation toConfirmation(InboundResponse.StartTransaction start) {
        StartTransactionConfirmation confirmation = new StartTransactionConfirmation();
        AuthorizationStatus status = switch (start.outcome()) {
            case ACCEPTED -> AuthorizationStatus.Accepted;
            case UNAUTHORIZED -> toAuthorizationStatus(start.verdict());
            case CONCURRENT_TX -> AuthorizationStatus.ConcurrentTx;
            case STORAGE_FAILURE -> AuthorizationStatus.Invalid;
        };
        confirmation.setTransactionId(start.isAccepted() ? start.transactionId() : 0);
        confirmation.setIdTagInfo(new IdTagInfo(status));
        return confirmation;
    }

    static AuthorizationStatus toAuthorizationStatus(Verdict verdict) {
        return switch (verdict) {
            case ACCEPTED -> AuthorizationStatus.Accepted;
            case BLOCKED -> AuthorizationStatus.Blocked;
            case EXPIRED -> AuthorizationStatus.Expired;
            case INVALID -> AuthorizationStatus.Invalid;
        };
    }

    // ========================================================================
    // Translation: commands → library requests
    // ========================================================================

    static Request toRequest(OcppCommand command) {
        if (command instanceof OcppCommand.RemoteStartTransaction remoteStart) {
            RemoteStartTransactionRequest request = new RemoteStartTransactionRequest();
            request.setIdTag(remoteStart.idTag());
            request.setConnectorId(remoteStart.connectorId());
            return request;
        } else if (command instanceof OcppCommand.RemoteStopTransaction remoteStop) {
            RemoteStopTransactionRequest request = new RemoteStopTransactionRequest();
            request.setTransactionId(remoteStop.transactionId());
            return request;
        } else if (command instanceof OcppCommand.ChangeAvailability changeAvailability) {
            ChangeAvailabilityRequest request = new ChangeAvailabilityRequest();
            request.setConnectorId(changeAvailability.connectorId());
            request.setType(changeAvailability.type() == Availability.OPERATIVE
                ? AvailabilityType.Operative
                : AvailabilityType.Inoperative);
            return request;
        } else if (command instanceof OcppCommand.Reset reset) {
            ResetRequest request = new ResetRequest();
            request.setType(reset.type() == OcppCommand.Reset.Type.HARD ? ResetType.Hard : ResetType.Soft);
            return request;
        } else if (command instanceof OcppCommand.ChangeConfiguration changeConfiguration) {
            ChangeConfigurationRequest request = new ChangeConfigurationRequest();
            request.setKey(changeConfiguration.key());
            request.setValue(changeConfiguration.value());
            return request;
        } else if (command instanceof OcppCommand.ClearCache) {
            return new ClearCacheRequest();
        }
        throw new IllegalArgumentException("Unsupported command: " + command.getClass().getName());
    }

    /**
     * Status value of a command confirmation as the charge point sent it, e.g. "Accepted".
     */
    static String statusOf(Confirmation confirmation) {
        if (confirmation instanceof RemoteStartTransactionConfirmation remoteStart) {
            return String.valueOf(remoteStart.getStatus());
        } else if (confirmation instanceof RemoteStopTransactionConfirmation remoteStop) {
            return String.valueOf(remoteStop.getStatus());
        } else if (confirmation instanceof ChangeAvailabilityConfirmation changeAvailability) {
            return String.valueOf(changeAvailability.getStatus());
        } else if (confirmation instanceof ResetConfirmation reset) {
            return String.valueOf(reset.getStatus());
        } else if (confirmation instanceof ChangeConfigurationConfirmation changeConfiguration) {
            return String.valueOf(changeConfiguration.getStatus());
        } else if (confirmation instanceof ClearCacheConfirmation clearCache) {
            return String.valueOf(clearCache.getStatus());
        }
        return null;
    }

    /**
     * Charge point id from the WebSocket path, e.g. "/ocpp/CP001" → "CP001".
     */
    static String chargePointIdFrom(String identifier) {
        if (identifier == null) {
            return null;
        }
        String trimmed = identifier.endsWith("/") ? identifier.substring(0, identifier.length() - 1) : identifier;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static Instant toInstant(ZonedDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static ZonedDateTime toZoned(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private String chargePointIdOf(UUID sessionId) {
        JsonChargePointConnection connection = sessions.get(sessionId);
        return connection != null ? connection.chargePointId() : "unknown-" + sessionId;
    }

    /**
     * Connection handle backed by one library session.
     */
    private class JsonChargePointConnection implements ChargePointConnection {
        private final UUID sessionId;
        private final String chargePointId;
        private volatile boolean open;

        JsonChargePointConnection(UUID sessionId, String chargePointId) {
            this.sessionId = sessionId;
            this.chargePointId = chargePointId;
            this.open = true;
        }

        @Override
        public String chargePointId() {
            return chargePointId;
        }

        @Override
        public CompletableFuture<CommandReply> send(OcppCommand command) {
            try {
                return server.send(sessionId, toRequest(command))
                    .toCompletableFuture()
                    .thenApply(confirmation -> new CommandReply(command.commandId(), statusOf(confirmation)));
            } catch (Exception e) {
                logger.error("Failed to send {} to {}: {}",
                    command.getClass().getSimpleName(), chargePointId, e.getMessage(), e);
                return CompletableFuture.failedFuture(e);
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            if (!open) {
                return;
            }
            open = false;
            server.closeSession(sessionId);
            logger.info("Closed session {} of charge point {}", sessionId, chargePointId);
        }

        void markClosed() {
            open = false;
        }
    }

    /**
     * Server event handler for connection/disconnection events.
     */
    private class ServerEventHandler implements ServerEvents {

        public void authenticateSession(SessionInformation information, String username, byte[] password) {
            logger.debug("Session authentication for {} (no credentials required)", information.getIdentifier());
        }

        @Override
        public void newSession(UUID sessionId, SessionInformation information) {
            String chargePointId = chargePointIdFrom(information.getIdentifier());
            JsonChargePointConnection connection = new JsonChargePointConnection(sessionId, chargePointId);
            sessions.put(sessionId, connection);
            logger.info("New session: charge point {} connected (session: {})", chargePointId, sessionId);

            try {
                coordinator.onConnect(chargePointId, connection);
            } catch (RuntimeException e) {
                logger.error("Error registering charge point {}: {}", chargePointId, e.getMessage(), e);
            }
        }

        @Override
        public void lostSession(UUID sessionId) {
            JsonChargePointConnection connection = sessions.remove(sessionId);
            if (connection == null) {
                logger.warn("Lost unknown session {}", sessionId);
                return;
            }
            connection.markClosed();
            logger.info("Lost session: charge point {} disconnected (session: {})",
                connection.chargePointId(), sessionId);

            try {
                coordinator.onDisconnect(connection.chargePointId(), connection);
            } catch (RuntimeException e) {
                logger.error("Error unregistering charge point {}: {}",
                    connection.chargePointId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Core event handler for OCPP messages. Exceptions thrown here are answered with a
     * CallError by the library.
     */
    private class CoreEventHandler implements ServerCoreEventHandler {

        @Override
        public BootNotificationConfirmation handleBootNotificationRequest(
            UUID sessionId,
            BootNotificationRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            return toConfirmation(coordinator.onBoot(toBootNotification(chargePointId, request)));
        }

        @Override
        public HeartbeatConfirmation handleHeartbeatRequest(UUID sessionId, HeartbeatRequest request) {
            String chargePointId = chargePointIdOf(sessionId);
            InboundResponse.Heartbeat heartbeat = coordinator.onHeartbeat(new InboundMessage.Heartbeat(chargePointId));

            HeartbeatConfirmation confirmation = new HeartbeatConfirmation();
            confirmation.setCurrentTime(toZoned(heartbeat.currentTime()));
            return confirmation;
        }

        @Override
        public AuthorizeConfirmation handleAuthorizeRequest(UUID sessionId, AuthorizeRequest request) {
            String chargePointId = chargePointIdOf(sessionId);
            InboundResponse.Authorize authorize = coordinator.onAuthorize(
                new InboundMessage.Authorize(chargePointId, request.getIdTag()));

            AuthorizeConfirmation confirmation = new AuthorizeConfirmation();
            confirmation.setIdTagInfo(new IdTagInfo(toAuthorizationStatus(authorize.verdict())));
            return confirmation;
        }

        @Override
        public StatusNotificationConfirmation handleStatusNotificationRequest(
            UUID sessionId,
            StatusNotificationRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            coordinator.onStatusNotification(toStatusNotification(chargePointId, request));
            return new StatusNotificationConfirmation();
        }

        @Override
        public StartTransactionConfirmation handleStartTransactionRequest(
            UUID sessionId,
            StartTransactionRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            return toConfirmation(coordinator.onStartTransaction(toStartTransaction(chargePointId, request)));
        }

        @Override
        public StopTransactionConfirmation handleStopTransactionRequest(
            UUID sessionId,
            StopTransactionRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            coordinator.onStopTransaction(toStopTransaction(chargePointId, request));

            StopTransactionConfirmation confirmation = new StopTransactionConfirmation();
            if (request.getIdTag() != null) {
                confirmation.setIdTagInfo(new IdTagInfo(AuthorizationStatus.Accepted));
            }
            return confirmation;
        }

        @Override
        public MeterValuesConfirmation handleMeterValuesRequest(
            UUID sessionId,
            MeterValuesRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            coordinator.onMeterValues(toMeterValues(chargePointId, request));
            return new MeterValuesConfirmation();
        }

        @Override
        public DataTransferConfirmation handleDataTransferRequest(
            UUID sessionId,
            DataTransferRequest request
        ) {
            String chargePointId = chargePointIdOf(sessionId);
            coordinator.onDataTransfer(new InboundMessage.DataTransfer(
                chargePointId, request.getVendorId(), request.getMessageId(), request.getData()));

            DataTransferConfirmation confirmation = new DataTransferConfirmation();
            confirmation.setStatus(DataTransferStatus.Accepted);
            return confirmation;
        }
    }
}
