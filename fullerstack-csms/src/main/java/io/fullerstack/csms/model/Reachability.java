package io.fullerstack.csms.model;

/**
 * Whether a charge point is currently reachable over its persistent connection.
 */
public enum Reachability {
    /**
     * Known from storage but not seen since this process started
     */
    UNKNOWN,

    /**
     * Sent traffic within the missed-heartbeat deadline
     */
    ONLINE,

    /**
     * Disconnected or silent past the missed-heartbeat deadline
     */
    OFFLINE
}
