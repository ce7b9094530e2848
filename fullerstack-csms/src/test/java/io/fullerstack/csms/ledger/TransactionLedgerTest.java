package io.fullerstack.csms.ledger;

import io.fullerstack.csms.model.ChargingSession;
import io.fullerstack.csms.model.MeterSample;
import io.fullerstack.csms.model.SessionStatus;
import io.fullerstack.csms.store.InMemoryChargingStore;
import io.fullerstack.csms.store.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * Unit tests for {@link TransactionLedger}.
 */
@DisplayName("TransactionLedger")
class TransactionLedgerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-05-01T11:00:00Z");

    private InMemoryChargingStore store;
    private TransactionLedger ledger;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryChargingStore());
        ledger = new TransactionLedger(store);
    }

    @Nested
    @DisplayName("Idle to Active")
    class Start {

        @Test
        @DisplayName("Start on an idle connector persists an active session")
        void testStart() {
            StartOutcome outcome = ledger.start("CP001", 1, "TAG001", 100, T0);

            assertThat(outcome.isStarted()).isTrue();
            ChargingSession session = outcome.session();
            assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);
            assertThat(store.findSession(session.transactionId())).contains(session);
            assertThat(ledger.activeSession("CP001", 1)).contains(session);
        }

        @Test
        @DisplayName("Second start on the same connector is refused without allocating an id")
        void testDoubleStartRefused() {
            ChargingSession first = ledger.start("CP001", 1, "TAG001", 100, T0).session();
            int nextBefore = store.nextTransactionId();

            StartOutcome second = ledger.start("CP001", 1, "TAG002", 200, T1);

            assertThat(second.isStarted()).isFalse();
            assertThat(second.session()).isEqualTo(first);
            assertThat(store.nextTransactionId()).as("no id consumed by the refusal").isEqualTo(nextBefore + 1);
        }

        @Test
        @DisplayName("Different connectors of one charge point are independent")
        void testConnectorsIndependent() {
            assertThat(ledger.start("CP001", 1, "TAG001", 100, T0).isStarted()).isTrue();
            assertThat(ledger.start("CP001", 2, "TAG002", 100, T0).isStarted()).isTrue();

            assertThat(ledger.activeSessions("CP001")).extracting(ChargingSession::connectorId).containsExactly(1, 2);
        }

        @Test
        @DisplayName("Failed insert rolls the connector back to idle")
        void testInsertFailureRollsBack() {
            doThrow(new StorageException("disk full")).when(store).insertSession(any());

            assertThatThrownBy(() -> ledger.start("CP001", 1, "TAG001", 100, T0))
                .isInstanceOf(StorageException.class);

            assertThat(ledger.activeSession("CP001", 1)).isEmpty();
            assertThat(ledger.activeCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Active to Idle")
    class Stop {

        @Test
        @DisplayName("Stop records reading, reason and energy")
        void testStop() {
            int transactionId = ledger.start("CP001", 1, "TAG001", 100, T0).session().transactionId();

            StopOutcome outcome = ledger.stop("CP001", transactionId, 1_600, T1, "Remote");

            assertThat(outcome.isStopped()).isTrue();
            ChargingSession completed = outcome.completedSession().orElseThrow();
            assertThat(completed.status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(completed.meterStop()).isEqualTo(1_600L);
            assertThat(completed.stopTimestamp()).isEqualTo(T1);
            assertThat(completed.stopReason()).isEqualTo("Remote");
            assertThat(completed.energyConsumedKwh()).isEqualTo(1.5);
            assertThat(store.findSession(transactionId)).contains(completed);
            assertThat(ledger.activeSession("CP001", 1)).isEmpty();
        }

        @Test
        @DisplayName("Unknown transaction id is NOT_FOUND and changes nothing")
        void testStopUnknown() {
            ChargingSession active = ledger.start("CP001", 1, "TAG001", 100, T0).session();

            StopOutcome outcome = ledger.stop("CP001", active.transactionId() + 42, 150, T1, "Local");

            assertThat(outcome.isStopped()).isFalse();
            assertThat(outcome.completedSession()).isEmpty();
            assertThat(ledger.activeSession("CP001", 1)).contains(active);
            assertThat(store.findSession(active.transactionId())).contains(active);
        }

        @Test
        @DisplayName("Transaction id of another charge point is NOT_FOUND")
        void testStopWrongChargePoint() {
            ChargingSession active = ledger.start("CP001", 1, "TAG001", 100, T0).session();

            StopOutcome outcome = ledger.stop("CP002", active.transactionId(), 150, T1, "Local");

            assertThat(outcome.isStopped()).isFalse();
            assertThat(ledger.activeSession("CP001", 1)).contains(active);
        }

        @Test
        @DisplayName("Stop reading below start reading is clamped")
        void testStopClamped() {
            int transactionId = ledger.start("CP001", 1, "TAG001", 500, T0).session().transactionId();

            ChargingSession completed = ledger.stop("CP001", transactionId, 400, T1, "Local")
                .completedSession().orElseThrow();

            assertThat(completed.meterStop()).isEqualTo(500L);
            assertThat(completed.energyConsumedKwh()).isZero();
        }

        @Test
        @DisplayName("Failed update keeps the session active")
        void testUpdateFailureKeepsActive() {
            ChargingSession active = ledger.start("CP001", 1, "TAG001", 100, T0).session();
            doThrow(new StorageException("timeout")).when(store).updateSession(any());

            assertThatThrownBy(() -> ledger.stop("CP001", active.transactionId(), 150, T1, "Local"))
                .isInstanceOf(StorageException.class);

            assertThat(ledger.activeSession("CP001", 1)).contains(active);
            assertThat(store.findSession(active.transactionId()).orElseThrow().isActive()).isTrue();
        }

        @Test
        @DisplayName("Connector is idle again after stop")
        void testRestartAfterStop() {
            int first = ledger.start("CP001", 1, "TAG001", 100, T0).session().transactionId();
            ledger.stop("CP001", first, 150, T1, "Local");

            StartOutcome again = ledger.start("CP001", 1, "TAG001", 150, T1);

            assertThat(again.isStarted()).isTrue();
            assertThat(again.session().transactionId()).isNotEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Meter samples")
    class Samples {

        @Test
        @DisplayName("Sample on an active connector is linked to its session")
        void testLinkedSample() {
            int transactionId = ledger.start("CP001", 1, "TAG001", 100, T0).session().transactionId();

            List<MeterSample> stored = ledger.recordSamples(
                List.of(sample("CP001", 1, 125), sample("CP001", 1, 126)), transactionId);

            assertThat(stored).extracting(MeterSample::transactionId).containsOnly(transactionId);
            assertThat(store.findMeterSamples(transactionId)).containsExactlyElementsOf(stored);
        }

        @Test
        @DisplayName("Sample on an idle connector is stored as orphaned")
        void testOrphanedSample() {
            MeterSample stored = ledger.recordSamples(List.of(sample("CP001", 3, 42)), 999).get(0);

            assertThat(stored.isOrphaned()).isTrue();
            assertThat(store.findOrphanedMeterSamples("CP001")).containsExactly(stored);
            assertThat(store.findSession(999)).isEmpty();
            assertThat(ledger.activeCount()).isZero();
        }

        @Test
        @DisplayName("Mismatching reported transaction id still links to the active session")
        void testMismatchedTransactionId() {
            int transactionId = ledger.start("CP001", 1, "TAG001", 100, T0).session().transactionId();

            MeterSample stored = ledger.recordSamples(List.of(sample("CP001", 1, 130)), transactionId + 7).get(0);

            assertThat(stored.transactionId()).isEqualTo(transactionId);
        }

        @Test
        @DisplayName("Empty batch writes nothing")
        void testEmptyBatch() {
            assertThat(ledger.recordSamples(List.of(), null)).isEmpty();
            assertThat(store.findOrphanedMeterSamples("CP001")).isEmpty();
        }
    }

    @Test
    @DisplayName("recover restores active sessions from storage")
    void testRecover() {
        ChargingSession active = ChargingSession.started(store.nextTransactionId(), "CP001", 1, "TAG001", 100, T0);
        store.insertSession(active);
        ChargingSession done = ChargingSession.started(store.nextTransactionId(), "CP001", 2, "TAG002", 100, T0)
            .completed(200, T1, "Local");
        store.insertSession(done);

        TransactionLedger restarted = new TransactionLedger(store);

        assertThat(restarted.recover()).isEqualTo(1);
        assertThat(restarted.activeSession("CP001", 1)).contains(active);
        assertThat(restarted.start("CP001", 1, "TAG003", 300, T1).isStarted()).isFalse();
    }

    private static MeterSample sample(String chargePointId, int connectorId, double value) {
        return new MeterSample(null, chargePointId, connectorId, T0.plusSeconds(60), value,
            MeterSample.DEFAULT_MEASURAND, MeterSample.DEFAULT_UNIT);
    }
}
