package io.fullerstack.csms.connection;

import io.fullerstack.csms.testkit.MutableClock;
import io.fullerstack.csms.testkit.RecordingConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link LivenessMonitor}.
 */
@DisplayName("LivenessMonitor")
class LivenessMonitorTest {

    private static final Duration DEADLINE = Duration.ofSeconds(750);

    private MutableClock clock;
    private ConnectionRegistry registry;
    private List<String> demoted;
    private LivenessMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        registry = new ConnectionRegistry(clock);
        demoted = new CopyOnWriteArrayList<>();
        OfflineTransition evicting = (chargePointId, now) -> {
            demoted.add(chargePointId);
            registry.evict(chargePointId).ifPresent(ChargePointConnection::close);
            return true;
        };
        monitor = new LivenessMonitor(registry, evicting, clock, DEADLINE, Duration.ofSeconds(100));
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    @DisplayName("Charge point at exactly the deadline stays online")
    void testNotDemotedAtDeadline() {
        registry.register("CP001", RecordingConnection.silent("CP001"));

        clock.advance(DEADLINE);

        assertThat(monitor.tick()).isZero();
        assertThat(demoted).isEmpty();
        assertThat(registry.isConnected("CP001")).isTrue();
    }

    @Test
    @DisplayName("Charge point past the deadline is demoted on the next tick")
    void testDemotedAfterDeadline() {
        RecordingConnection connection = RecordingConnection.silent("CP001");
        registry.register("CP001", connection);

        clock.advance(DEADLINE.plusMillis(1));

        assertThat(monitor.tick()).isEqualTo(1);
        assertThat(demoted).containsExactly("CP001");
        assertThat(connection.isClosed()).isTrue();
        assertThat(registry.onlineChargePoints()).isEmpty();
    }

    @Test
    @DisplayName("Any traffic resets the deadline")
    void testTrafficKeepsOnline() {
        registry.register("CP001", RecordingConnection.silent("CP001"));

        clock.advance(Duration.ofSeconds(700));
        registry.touch("CP001");
        clock.advance(Duration.ofSeconds(700));

        assertThat(monitor.tick()).isZero();
    }

    @Test
    @DisplayName("Only silent charge points are demoted")
    void testOnlySilentDemoted() {
        registry.register("CP-QUIET", RecordingConnection.silent("CP-QUIET"));
        clock.advance(Duration.ofSeconds(500));
        registry.register("CP-CHATTY", RecordingConnection.silent("CP-CHATTY"));
        clock.advance(Duration.ofSeconds(500));

        monitor.tick();

        assertThat(demoted).containsExactly("CP-QUIET");
        assertThat(registry.onlineChargePoints()).containsExactly("CP-CHATTY");
    }

    @Test
    @DisplayName("A transition that declines does not count as demotion")
    void testTransitionDeclines() {
        LivenessMonitor declining = new LivenessMonitor(
            registry, (chargePointId, now) -> false, clock, DEADLINE, Duration.ofSeconds(100));
        registry.register("CP001", RecordingConnection.silent("CP001"));
        clock.advance(DEADLINE.multipliedBy(2));

        assertThat(declining.tick()).isZero();
        declining.close();
    }

    @Test
    @DisplayName("Scheduled sweep demotes without manual ticks")
    void testScheduledSweep() {
        // GIVEN: real clock, tiny deadline and interval
        ConnectionRegistry liveRegistry = new ConnectionRegistry(Clock.systemUTC());
        List<String> liveDemoted = new CopyOnWriteArrayList<>();
        LivenessMonitor live = new LivenessMonitor(
            liveRegistry,
            (chargePointId, now) -> {
                liveDemoted.add(chargePointId);
                liveRegistry.evict(chargePointId);
                return true;
            },
            Clock.systemUTC(),
            Duration.ofMillis(100),
            Duration.ofMillis(50));
        liveRegistry.register("CP001", RecordingConnection.silent("CP001"));

        // WHEN
        live.start();

        // THEN
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(liveDemoted).containsExactly("CP001"));
        assertThat(live.isRunning()).isTrue();

        live.close();
        assertThat(live.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Charge point restored from storage is demoted once its stored activity is overdue")
    void testRestoredEntryDemoted() {
        Instant storedLastSeen = clock.instant().minus(Duration.ofHours(2));

        assertThat(registry.restore("CP009", storedLastSeen)).isTrue();
        assertThat(registry.restore("CP009", clock.instant())).isFalse();

        assertThat(registry.isConnected("CP009")).isFalse();
        assertThat(monitor.tick()).isEqualTo(1);
        assertThat(demoted).containsExactly("CP009");
    }

    @Test
    @DisplayName("Stopped monitor can be started again, closed monitor cannot")
    void testRestartAfterStop() {
        monitor.start();
        monitor.stop();
        assertThat(monitor.isRunning()).isFalse();

        monitor.start();
        assertThat(monitor.isRunning()).isTrue();

        monitor.close();
        assertThat(monitor.isRunning()).isFalse();
        assertThatThrownBy(() -> monitor.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
    }

    @Test
    @DisplayName("isOverdue is strictly greater than the deadline")
    void testIsOverdueBoundary() {
        Instant last = clock.instant();

        assertThat(monitor.isOverdue(last, last.plus(DEADLINE))).isFalse();
        assertThat(monitor.isOverdue(last, last.plus(DEADLINE).plusNanos(1))).isTrue();
    }
}
