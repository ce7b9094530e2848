package io.fullerstack.csms.server;

import io.fullerstack.csms.model.Verdict;

import java.time.Instant;

/**
 * Protocol-level answer produced by the session coordinator for an {@link InboundMessage}.
 */
public sealed interface InboundResponse permits
    InboundResponse.Boot,
    InboundResponse.Heartbeat,
    InboundResponse.Authorize,
    InboundResponse.StartTransaction,
    InboundResponse.Acknowledged {

    /**
     * Registration result of a BootNotification
     */
    enum Registration {
        ACCEPTED,
        PENDING
    }

    record Boot(
        Registration status,
        Instant currentTime,
        int heartbeatIntervalSeconds
    ) implements InboundResponse {}

    record Heartbeat(Instant currentTime) implements InboundResponse {}

    record Authorize(Verdict verdict) implements InboundResponse {}

    /**
     * Answer to StartTransaction. {@code transactionId} is only set when the outcome is
     * {@link Outcome#ACCEPTED}.
     */
    record StartTransaction(
        Outcome outcome,
        Verdict verdict,
        Integer transactionId
    ) implements InboundResponse {

        public enum Outcome {
            /**
             * Session started, transaction id allocated
             */
            ACCEPTED,

            /**
             * Tag verdict was not ACCEPTED
             */
            UNAUTHORIZED,

            /**
             * Connector already has an active session
             */
            CONCURRENT_TX,

            /**
             * Session could not be persisted, nothing was started
             */
            STORAGE_FAILURE
        }

        public static StartTransaction accepted(int transactionId) {
            return new StartTransaction(Outcome.ACCEPTED, Verdict.ACCEPTED, transactionId);
        }

        public static StartTransaction rejected(Outcome outcome, Verdict verdict) {
            return new StartTransaction(outcome, verdict, null);
        }

        public boolean isAccepted() {
            return outcome == Outcome.ACCEPTED;
        }
    }

    /**
     * Plain acceptance for messages whose protocol response carries no decision
     * (StatusNotification, StopTransaction, MeterValues, DataTransfer).
     */
    record Acknowledged() implements InboundResponse {
        public static final Acknowledged INSTANCE = new Acknowledged();
    }
}
