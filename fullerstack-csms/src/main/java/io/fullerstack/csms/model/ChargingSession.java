package io.fullerstack.csms.model;

import java.time.Instant;

/**
 * Domain model representing one charging transaction, from authorized start to reported stop.
 * <p>
 * Meter readings are in Wh. {@code meterStop}, {@code stopTimestamp}, {@code stopReason}
 * and {@code energyConsumedKwh} stay {@code null} while the session is active.
 * </p>
 */
public record ChargingSession(
    int transactionId,
    String chargePointId,
    int connectorId,
    String idTag,
    long meterStart,
    Long meterStop,
    Instant startTimestamp,
    Instant stopTimestamp,
    SessionStatus status,
    String stopReason,
    Double energyConsumedKwh
) {
    /**
     * Creates a new session in ACTIVE status.
     */
    public static ChargingSession started(
        int transactionId,
        String chargePointId,
        int connectorId,
        String idTag,
        long meterStart,
        Instant startTimestamp
    ) {
        return new ChargingSession(
            transactionId,
            chargePointId,
            connectorId,
            idTag,
            meterStart,
            null,
            startTimestamp,
            null,
            SessionStatus.ACTIVE,
            null,
            null
        );
    }

    /**
     * Returns a copy of this session marked as completed. The stop reading must not be
     * below the start reading.
     */
    public ChargingSession completed(long meterStopWh, Instant stoppedAt, String reason) {
        if (meterStopWh < meterStart) {
            throw new IllegalArgumentException(
                "meterStop " + meterStopWh + " is below meterStart " + meterStart
                    + " for transaction " + transactionId);
        }
        return new ChargingSession(
            transactionId,
            chargePointId,
            connectorId,
            idTag,
            meterStart,
            meterStopWh,
            startTimestamp,
            stoppedAt,
            SessionStatus.COMPLETED,
            reason,
            (meterStopWh - meterStart) / 1000.0
        );
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
