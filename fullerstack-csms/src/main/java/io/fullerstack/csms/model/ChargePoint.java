package io.fullerstack.csms.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain model representing a charge point known to the central system.
 * <p>
 * Created on the first BootNotification and kept across reconnects. Reachability is only
 * changed by the session coordinator (on traffic, disconnect or liveness demotion).
 * </p>
 */
public record ChargePoint(
    String chargePointId,
    String vendor,
    String model,
    String serialNumber,
    String firmwareVersion,
    ConnectorStatus status,
    Reachability reachability,
    Instant lastSeen,
    Instant bootTime
) {
    public ChargePoint {
        Objects.requireNonNull(chargePointId, "chargePointId must not be null");
        Objects.requireNonNull(reachability, "reachability must not be null");
    }

    /**
     * Creates the record for a charge point seen for the first time in a BootNotification.
     */
    public static ChargePoint booted(
        String chargePointId,
        String vendor,
        String model,
        String serialNumber,
        String firmwareVersion,
        Instant bootTime
    ) {
        return new ChargePoint(
            chargePointId,
            vendor,
            model,
            serialNumber,
            firmwareVersion,
            null,
            Reachability.ONLINE,
            bootTime,
            bootTime
        );
    }

    /**
     * Returns a copy with the identity fields of a later BootNotification.
     */
    public ChargePoint rebooted(
        String vendor,
        String model,
        String serialNumber,
        String firmwareVersion,
        Instant bootTime
    ) {
        return new ChargePoint(
            chargePointId,
            vendor,
            model,
            serialNumber,
            firmwareVersion,
            status,
            Reachability.ONLINE,
            bootTime,
            bootTime
        );
    }

    /**
     * Returns a copy with updated reachability and last-seen time.
     */
    public ChargePoint withReachability(Reachability newReachability, Instant seenAt) {
        return new ChargePoint(
            chargePointId,
            vendor,
            model,
            serialNumber,
            firmwareVersion,
            status,
            newReachability,
            seenAt,
            bootTime
        );
    }

    /**
     * Returns a copy with the status reported for connector 0 (the whole charge point).
     */
    public ChargePoint withStatus(ConnectorStatus newStatus) {
        return new ChargePoint(
            chargePointId,
            vendor,
            model,
            serialNumber,
            firmwareVersion,
            newStatus,
            reachability,
            lastSeen,
            bootTime
        );
    }

    public boolean isOnline() {
        return reachability == Reachability.ONLINE;
    }
}
