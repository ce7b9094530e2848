package io.fullerstack.csms.store;

import io.fullerstack.csms.model.ChargePoint;
import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.Connector;
import io.fullerstack.csms.model.DataTransfer;
import io.fullerstack.csms.model.IdTag;
import io.fullerstack.csms.model.MeterSample;
import io.fullerstack.csms.model.Reachability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link ChargingStore} kept entirely in memory.
 * <p>
 * Mirrors the relational schema: charge points, connectors, id tags, sessions with a unique
 * transaction id, meter samples cascading with their session, configuration and data
 * transfers. Used by tests and by a single-process deployment without a database.
 * </p>
 */
public class InMemoryChargingStore implements ChargingStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryChargingStore.class);

    private final Map<String, ChargePoint> chargePoints = new ConcurrentHashMap<>();
    private final Map<ConnectorKey, Connector> connectors = new ConcurrentHashMap<>();
    private final Map<String, IdTag> idTags = new ConcurrentHashMap<>();
    private final Map<Integer, ChargingSession> sessions = new ConcurrentHashMap<>();
    private final Map<Integer, List<MeterSample>> meterSamples = new ConcurrentHashMap<>();
    private final Map<String, List<MeterSample>> orphanedSamples = new ConcurrentHashMap<>();
    private final Map<String, String> configuration = new ConcurrentHashMap<>();
    private final Map<String, List<DataTransfer>> dataTransfers = new ConcurrentHashMap<>();
    private final AtomicInteger transactionSequence;

    public InMemoryChargingStore() {
        this(1);
    }

    /**
     * @param firstTransactionId first id handed out by {@link #nextTransactionId()}
     */
    public InMemoryChargingStore(int firstTransactionId) {
        if (firstTransactionId <= 0) {
            throw new IllegalArgumentException("firstTransactionId must be positive, got: " + firstTransactionId);
        }
        this.transactionSequence = new AtomicInteger(firstTransactionId);
    }

    @Override
    public void upsertChargePoint(ChargePoint chargePoint) {
        chargePoints.put(chargePoint.chargePointId(), chargePoint);
    }

    @Override
    public Optional<ChargePoint> findChargePoint(String chargePointId) {
        return Optional.ofNullable(chargePoints.get(chargePointId));
    }

    @Override
    public List<ChargePoint> findAllChargePoints() {
        return chargePoints.values().stream()
            .sorted(Comparator.comparing(ChargePoint::chargePointId))
            .collect(Collectors.toList());
    }

    @Override
    public void updateReachability(String chargePointId, Reachability reachability, Instant seenAt) {
        chargePoints.computeIfPresent(chargePointId,
            (id, current) -> current.withReachability(reachability, seenAt));
    }

    @Override
    public void upsertConnector(Connector connector) {
        connectors.put(new ConnectorKey(connector.chargePointId(), connector.connectorId()), connector);
    }

    @Override
    public Optional<Connector> findConnector(String chargePointId, int connectorId) {
        return Optional.ofNullable(connectors.get(new ConnectorKey(chargePointId, connectorId)));
    }

    @Override
    public List<Connector> findConnectors(String chargePointId) {
        return connectors.values().stream()
            .filter(connector -> connector.chargePointId().equals(chargePointId))
            .sorted(Comparator.comparingInt(Connector::connectorId))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<IdTag> findIdTag(String tag) {
        return Optional.ofNullable(idTags.get(tag));
    }

    @Override
    public void upsertIdTag(IdTag idTag) {
        idTags.put(idTag.tag(), idTag);
    }

    @Override
    public int nextTransactionId() {
        return transactionSequence.getAndIncrement();
    }

    @Override
    public void insertSession(ChargingSession session) {
        ChargingSession existing = sessions.putIfAbsent(session.transactionId(), session);
        if (existing != null) {
            throw new StorageException("Duplicate transaction id " + session.transactionId());
        }
    }

    @Override
    public void updateSession(ChargingSession session) {
        ChargingSession previous = sessions.replace(session.transactionId(), session);
        if (previous == null) {
            throw new StorageException("No session with transaction id " + session.transactionId());
        }
    }

    @Override
    public Optional<ChargingSession> findSession(int transactionId) {
        return Optional.ofNullable(sessions.get(transactionId));
    }

    @Override
    public Optional<ChargingSession> findActiveSession(String chargePointId, int connectorId) {
        return sessions.values().stream()
            .filter(ChargingSession::isActive)
            .filter(session -> session.chargePointId().equals(chargePointId))
            .filter(session -> session.connectorId() == connectorId)
            .findFirst();
    }

    @Override
    public List<ChargingSession> findActiveSessions() {
        return sessions.values().stream()
            .filter(ChargingSession::isActive)
            .sorted(Comparator.comparingInt(ChargingSession::transactionId))
            .collect(Collectors.toList());
    }

    @Override
    public List<ChargingSession> findSessions(String chargePointId) {
        return sessions.values().stream()
            .filter(session -> session.chargePointId().equals(chargePointId))
            .sorted(Comparator.comparingInt(ChargingSession::transactionId))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteSession(int transactionId) {
        sessions.remove(transactionId);
        List<MeterSample> removed = meterSamples.remove(transactionId);
        logger.debug("Deleted session {} and {} meter samples", transactionId,
            removed == null ? 0 : removed.size());
    }

    @Override
    public synchronized void appendMeterSamples(List<MeterSample> samples) {
        for (MeterSample sample : samples) {
            if (!sample.isOrphaned() && !sessions.containsKey(sample.transactionId())) {
                throw new StorageException("Meter sample references unknown transaction " + sample.transactionId());
            }
        }
        for (MeterSample sample : samples) {
            if (sample.isOrphaned()) {
                orphanedSamples
                    .computeIfAbsent(sample.chargePointId(), id -> new CopyOnWriteArrayList<>())
                    .add(sample);
            } else {
                meterSamples
                    .computeIfAbsent(sample.transactionId(), id -> new CopyOnWriteArrayList<>())
                    .add(sample);
            }
        }
        logger.debug("Appended {} meter sample(s)", samples.size());
    }

    @Override
    public List<MeterSample> findMeterSamples(int transactionId) {
        return List.copyOf(meterSamples.getOrDefault(transactionId, Collections.emptyList()));
    }

    @Override
    public List<MeterSample> findOrphanedMeterSamples(String chargePointId) {
        return List.copyOf(orphanedSamples.getOrDefault(chargePointId, Collections.emptyList()));
    }

    @Override
    public void putConfiguration(String key, String value) {
        configuration.put(key, value);
    }

    @Override
    public Optional<String> findConfiguration(String key) {
        return Optional.ofNullable(configuration.get(key));
    }

    @Override
    public void appendDataTransfer(DataTransfer dataTransfer) {
        dataTransfers
            .computeIfAbsent(dataTransfer.chargePointId(), id -> new CopyOnWriteArrayList<>())
            .add(dataTransfer);
    }

    @Override
    public List<DataTransfer> findDataTransfers(String chargePointId) {
        return List.copyOf(dataTransfers.getOrDefault(chargePointId, Collections.emptyList()));
    }

    private record ConnectorKey(String chargePointId, int connectorId) {}
}
