package io.fullerstack.csms.ledger;

import io.fullerstack.csms.model.ChargingSession;

import java.util.Optional;

/**
 * Result of an Active to Idle transition attempt.
 *
 * @param kind    whether a matching active session was stopped
 * @param session the completed session, null when not found
 */
public record StopOutcome(Kind kind, ChargingSession session) {

    public enum Kind {
        STOPPED,
        NOT_FOUND
    }

    public static StopOutcome stopped(ChargingSession completed) {
        return new StopOutcome(Kind.STOPPED, completed);
    }

    public static StopOutcome notFound() {
        return new StopOutcome(Kind.NOT_FOUND, null);
    }

    public boolean isStopped() {
        return kind == Kind.STOPPED;
    }

    public Optional<ChargingSession> completedSession() {
        return Optional.ofNullable(session);
    }
}
