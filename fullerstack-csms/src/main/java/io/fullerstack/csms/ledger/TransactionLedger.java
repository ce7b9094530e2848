package io.fullerstack.csms.ledger;

import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.MeterSample;
import io.fullerstack.csms.store.ChargingStore;
import io.fullerstack.csms.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-connector transaction state machine.
 * <p>
 * Each (charge point, connector) pair is either Idle (no entry) or Active (exactly one
 * {@link ChargingSession} with status ACTIVE). Transitions are written through to the
 * {@link ChargingStore}; when the write fails the in-memory transition is undone before the
 * {@link StorageException} propagates, so memory and store never disagree about which
 * session is active.
 * </p>
 * <p>
 * Both device-reported and centrally-requested stops end in {@link #stop}, the single
 * Active to Idle transition.
 * </p>
 */
public class TransactionLedger {
    private static final Logger logger = LoggerFactory.getLogger(TransactionLedger.class);

    private final ChargingStore store;
    private final Map<ConnectorKey, ChargingSession> active;

    public TransactionLedger(ChargingStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.active = new ConcurrentHashMap<>();
    }

    /**
     * Rebuilds the Active entries from the store, e.g. after a restart.
     *
     * @return number of active sessions restored
     */
    public int recover() {
        int restored = 0;
        for (ChargingSession session : store.findActiveSessions()) {
            ConnectorKey key = ConnectorKey.of(session);
            ChargingSession existing = active.putIfAbsent(key, session);
            if (existing == null) {
                restored++;
            } else if (existing.transactionId() != session.transactionId()) {
                logger.error("Store holds two active sessions for {} connector {}: {} and {}, keeping {}",
                    session.chargePointId(), session.connectorId(),
                    existing.transactionId(), session.transactionId(), existing.transactionId());
            }
        }
        logger.info("Recovered {} active session(s) from storage", restored);
        return restored;
    }

    /**
     * Idle to Active. Refused if the connector already has an active session; the
     * transaction id is only allocated once that check has passed.
     *
     * @throws StorageException if the session cannot be persisted; nothing is started then
     */
    public StartOutcome start(String chargePointId, int connectorId, String idTag, long meterStart, Instant timestamp) {
        ConnectorKey key = new ConnectorKey(chargePointId, connectorId);
        ChargingSession current = active.get(key);
        if (current != null) {
            logger.warn("Refusing start on {} connector {}: transaction {} already active",
                chargePointId, connectorId, current.transactionId());
            return StartOutcome.alreadyActive(current);
        }

        ChargingSession session = ChargingSession.started(
            store.nextTransactionId(), chargePointId, connectorId, idTag, meterStart, timestamp);

        ChargingSession raced = active.putIfAbsent(key, session);
        if (raced != null) {
            logger.warn("Refusing start on {} connector {}: transaction {} became active concurrently",
                chargePointId, connectorId, raced.transactionId());
            return StartOutcome.alreadyActive(raced);
        }

        try {
            store.insertSession(session);
        } catch (StorageException e) {
            active.remove(key, session);
            logger.error("Rolled back start of transaction {} on {} connector {}: {}",
                session.transactionId(), chargePointId, connectorId, e.getMessage());
            throw e;
        }

        logger.info("Transaction {} started on {} connector {} for {} (meterStart {} Wh)",
            session.transactionId(), chargePointId, connectorId, idTag, meterStart);
        return StartOutcome.started(session);
    }

    /**
     * Active to Idle for the session with the given transaction id on this charge point.
     * A transaction id that is not the active session of one of the charge point's connectors
     * leaves every state untouched and yields {@link StopOutcome.Kind#NOT_FOUND}.
     * <p>
     * A stop reading below the start reading is clamped to the start reading.
     * </p>
     *
     * @throws StorageException if the completed session cannot be persisted; the session stays active then
     */
    public StopOutcome stop(String chargePointId, int transactionId, long meterStop, Instant timestamp, String reason) {
        Optional<ChargingSession> match = findActive(chargePointId, transactionId);
        if (match.isEmpty()) {
            logger.warn("No active transaction {} on charge point {}", transactionId, chargePointId);
            return StopOutcome.notFound();
        }

        ChargingSession session = match.get();
        ConnectorKey key = ConnectorKey.of(session);

        long stopReading = meterStop;
        if (meterStop < session.meterStart()) {
            logger.warn("Transaction {} reported meterStop {} below meterStart {}, clamping",
                transactionId, meterStop, session.meterStart());
            stopReading = session.meterStart();
        }
        ChargingSession completed = session.completed(stopReading, timestamp, reason);

        if (!active.remove(key, session)) {
            logger.warn("Transaction {} on {} was stopped concurrently", transactionId, chargePointId);
            return StopOutcome.notFound();
        }

        try {
            store.updateSession(completed);
        } catch (StorageException e) {
            active.putIfAbsent(key, session);
            logger.error("Rolled back stop of transaction {} on {}: {}",
                transactionId, chargePointId, e.getMessage());
            throw e;
        }

        logger.info("Transaction {} stopped on {} connector {} ({} kWh, reason {})",
            transactionId, chargePointId, key.connectorId(), completed.energyConsumedKwh(), reason);
        return StopOutcome.stopped(completed);
    }

    /**
     * Persists the samples of one message in a single write, linked to the active session of
     * their connector if there is one and orphaned otherwise.
     *
     * @param samples             samples without a transaction id, all on the same connector
     * @param reportedTransaction transaction id the charge point put in the message, may be null
     * @return the samples as stored
     * @throws StorageException if the batch cannot be written; none of it is stored then
     */
    public List<MeterSample> recordSamples(List<MeterSample> samples, Integer reportedTransaction) {
        if (samples.isEmpty()) {
            return List.of();
        }
        MeterSample first = samples.get(0);
        ChargingSession session = active.get(new ConnectorKey(first.chargePointId(), first.connectorId()));

        Integer transactionId;
        if (session != null) {
            if (reportedTransaction != null && reportedTransaction != session.transactionId()) {
                logger.warn("Meter samples on {} connector {} name transaction {} but {} is active, linking to {}",
                    first.chargePointId(), first.connectorId(), reportedTransaction,
                    session.transactionId(), session.transactionId());
            }
            transactionId = session.transactionId();
        } else {
            logger.warn("{} orphaned meter sample(s) on {} connector {} (reported transaction {})",
                samples.size(), first.chargePointId(), first.connectorId(), reportedTransaction);
            transactionId = null;
        }

        List<MeterSample> stored = samples.stream()
            .map(sample -> new MeterSample(transactionId, sample.chargePointId(), sample.connectorId(),
                sample.timestamp(), sample.value(), sample.measurand(), sample.unit()))
            .collect(Collectors.toList());
        store.appendMeterSamples(stored);
        return stored;
    }

    public Optional<ChargingSession> activeSession(String chargePointId, int connectorId) {
        return Optional.ofNullable(active.get(new ConnectorKey(chargePointId, connectorId)));
    }

    /**
     * Finds the active session with this transaction id on one of the charge point's connectors.
     */
    public Optional<ChargingSession> findActive(String chargePointId, int transactionId) {
        return active.values().stream()
            .filter(session -> session.chargePointId().equals(chargePointId))
            .filter(session -> session.transactionId() == transactionId)
            .findFirst();
    }

    public List<ChargingSession> activeSessions(String chargePointId) {
        return active.values().stream()
            .filter(session -> session.chargePointId().equals(chargePointId))
            .sorted(Comparator.comparingInt(ChargingSession::connectorId))
            .collect(Collectors.toList());
    }

    public List<ChargingSession> activeSessions() {
        return active.values().stream()
            .sorted(Comparator.comparingInt(ChargingSession::transactionId))
            .collect(Collectors.toList());
    }

    public int activeCount() {
        return active.size();
    }

    private record ConnectorKey(String chargePointId, int connectorId) {
        static ConnectorKey of(ChargingSession session) {
            return new ConnectorKey(session.chargePointId(), session.connectorId());
        }
    }
}
