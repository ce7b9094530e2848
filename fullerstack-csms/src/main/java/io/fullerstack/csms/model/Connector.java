package io.fullerstack.csms.model;

import java.time.Instant;

/**
 * A physical connector on a charge point, identified by its index within the owner.
 * Connector 0 addresses the charge point as a whole.
 */
public record Connector(
    String chargePointId,
    int connectorId,
    ConnectorStatus status,
    Availability availability,
    String errorCode,
    String info,
    Instant lastStatusUpdate
) {
    /**
     * Returns a copy with a newly reported status.
     */
    public Connector withStatus(ConnectorStatus newStatus, String newErrorCode, String newInfo, Instant reportedAt) {
        return new Connector(chargePointId, connectorId, newStatus, availability, newErrorCode, newInfo, reportedAt);
    }

    /**
     * Returns a copy with a new availability.
     */
    public Connector withAvailability(Availability newAvailability) {
        return new Connector(chargePointId, connectorId, status, newAvailability, errorCode, info, lastStatusUpdate);
    }
}
