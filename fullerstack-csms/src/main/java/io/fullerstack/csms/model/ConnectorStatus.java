package io.fullerstack.csms.model;

/**
 * Operational status of a connector as reported by the charge point in StatusNotification.
 * Maps to OCPP 1.6 ChargePointStatus values.
 */
public enum ConnectorStatus {
    /**
     * Connector is free and can start a new session
     */
    AVAILABLE,

    /**
     * A user presented a tag or plugged in, session not started yet
     */
    PREPARING,

    /**
     * Energy is being delivered
     */
    CHARGING,

    /**
     * Charging suspended by the EV or by the EVSE
     */
    SUSPENDED_EV,
    SUSPENDED_EVSE,

    /**
     * Session stopped, cable still plugged in
     */
    FINISHING,

    /**
     * Reserved for a specific tag
     */
    RESERVED,

    /**
     * Not available for new sessions (Inoperative)
     */
    UNAVAILABLE,

    /**
     * Connector reports an error
     */
    FAULTED;

    /**
     * Parses an OCPP status string such as "SuspendedEVSE" or "Charging".
     */
    public static ConnectorStatus fromOcpp(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Connector status must not be null");
        }
        String normalized = value.replace("_", "");
        for (ConnectorStatus status : values()) {
            if (status.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown connector status: " + value);
    }
}
