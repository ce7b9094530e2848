package io.fullerstack.csms.ledger;

import io.fullerstack.csms.model.ChargingSession;

/**
 * Result of an Idle to Active transition attempt.
 *
 * @param kind    whether the session was started
 * @param session the new session if started, the already active one otherwise
 */
public record StartOutcome(Kind kind, ChargingSession session) {

    public enum Kind {
        STARTED,
        ALREADY_ACTIVE
    }

    public static StartOutcome started(ChargingSession session) {
        return new StartOutcome(Kind.STARTED, session);
    }

    public static StartOutcome alreadyActive(ChargingSession existing) {
        return new StartOutcome(Kind.ALREADY_ACTIVE, existing);
    }

    public boolean isStarted() {
        return kind == Kind.STARTED;
    }
}
