package io.fullerstack.csms.store;

import io.fullerstack.csms.model.ChargePoint;
import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.Connector;
import io.fullerstack.csms.model.DataTransfer;
import io.fullerstack.csms.model.IdTag;
import io.fullerstack.csms.model.MeterSample;
import io.fullerstack.csms.model.Reachability;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for the central system.
 * <p>
 * Implementations provide atomic single-record upserts and report every failure as a
 * {@link StorageException}. Transaction ids returned by {@link #nextTransactionId()} must
 * be unique for the lifetime of the store.
 * </p>
 */
public interface ChargingStore {

    // Charge points

    void upsertChargePoint(ChargePoint chargePoint);

    Optional<ChargePoint> findChargePoint(String chargePointId);

    List<ChargePoint> findAllChargePoints();

    /**
     * Updates reachability and last-seen time of an existing charge point.
     * Unknown charge points are ignored.
     */
    void updateReachability(String chargePointId, Reachability reachability, Instant seenAt);

    // Connectors

    void upsertConnector(Connector connector);

    Optional<Connector> findConnector(String chargePointId, int connectorId);

    List<Connector> findConnectors(String chargePointId);

    // Identity tags

    Optional<IdTag> findIdTag(String tag);

    void upsertIdTag(IdTag idTag);

    // Sessions

    int nextTransactionId();

    /**
     * Inserts a new session. Fails if the transaction id is already taken.
     */
    void insertSession(ChargingSession session);

    void updateSession(ChargingSession session);

    Optional<ChargingSession> findSession(int transactionId);

    Optional<ChargingSession> findActiveSession(String chargePointId, int connectorId);

    List<ChargingSession> findActiveSessions();

    List<ChargingSession> findSessions(String chargePointId);

    /**
     * Deletes a session together with its meter samples.
     */
    void deleteSession(int transactionId);

    // Meter samples

    /**
     * Appends a batch of samples atomically: either every sample is stored or none is.
     */
    void appendMeterSamples(List<MeterSample> samples);

    List<MeterSample> findMeterSamples(int transactionId);

    List<MeterSample> findOrphanedMeterSamples(String chargePointId);

    // Configuration and data transfers

    void putConfiguration(String key, String value);

    Optional<String> findConfiguration(String key);

    void appendDataTransfer(DataTransfer dataTransfer);

    List<DataTransfer> findDataTransfers(String chargePointId);
}
