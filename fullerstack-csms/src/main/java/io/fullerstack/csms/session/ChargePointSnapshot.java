package io.fullerstack.csms.session;

import io.fullerstack.csms.model.ChargePoint;
import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.Connector;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one charge point for administrative queries.
 *
 * @param chargePoint    stored charge point record
 * @param connected      whether this process holds a live connection for it
 * @param lastActivity   last inbound traffic seen by this process, null if none
 * @param connectors     known connectors ordered by id
 * @param activeSessions sessions currently active on its connectors
 */
public record ChargePointSnapshot(
    ChargePoint chargePoint,
    boolean connected,
    Instant lastActivity,
    List<Connector> connectors,
    List<ChargingSession> activeSessions
) {
    public ChargePointSnapshot {
        connectors = List.copyOf(connectors);
        activeSessions = List.copyOf(activeSessions);
    }
}
