package io.fullerstack.csms.model;

/**
 * Lifecycle status of a charging session.
 */
public enum SessionStatus {
    /**
     * Started and not yet reported stopped by the charge point
     */
    ACTIVE,

    /**
     * Stop reported, stop meter reading recorded
     */
    COMPLETED
}
