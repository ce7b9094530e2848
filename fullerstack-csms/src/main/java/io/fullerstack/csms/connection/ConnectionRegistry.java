package io.fullerstack.csms.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide map from charge point id to its live connection and last activity.
 * <p>
 * A charge point is considered online exactly while it has an entry here. An entry may exist
 * without a connection handle when traffic is seen before the transport registered one;
 * {@link #lookup(String)} then reports the charge point as not connected.
 * </p>
 * <p>
 * All updates are per-key ({@link ConcurrentHashMap#compute}), so unrelated charge points
 * never contend.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Entry> entries;
    private final Clock clock;

    public ConnectionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new ConcurrentHashMap<>();
    }

    /**
     * Registers the live connection of a charge point. A different handle already registered
     * for the same id is superseded and closed.
     */
    public void register(String chargePointId, ChargePointConnection connection) {
        Objects.requireNonNull(connection, "connection must not be null");
        AtomicReference<ChargePointConnection> superseded = new AtomicReference<>();
        Instant now = clock.instant();

        entries.compute(chargePointId, (id, current) -> {
            if (current != null && current.connection() != null && current.connection() != connection) {
                superseded.set(current.connection());
            }
            return new Entry(connection, now);
        });

        ChargePointConnection stale = superseded.get();
        if (stale != null) {
            logger.warn("Charge point {} reconnected, closing superseded connection", chargePointId);
            stale.close();
        } else {
            logger.info("Registered connection for charge point {}", chargePointId);
        }
    }

    /**
     * @return the live connection, or empty if the charge point is not connected
     */
    public Optional<ChargePointConnection> lookup(String chargePointId) {
        Entry entry = entries.get(chargePointId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.connection());
    }

    /**
     * Removes the entry if it still holds the given handle.
     *
     * @return true if the entry was removed, false if the handle had already been superseded
     */
    public boolean unregister(String chargePointId, ChargePointConnection connection) {
        AtomicBoolean removed = new AtomicBoolean(false);
        entries.computeIfPresent(chargePointId, (id, current) -> {
            if (current.connection() == connection) {
                removed.set(true);
                return null;
            }
            return current;
        });
        if (removed.get()) {
            logger.info("Unregistered connection for charge point {}", chargePointId);
        } else {
            logger.debug("Ignoring unregister of superseded connection for charge point {}", chargePointId);
        }
        return removed.get();
    }

    /**
     * Removes the entry whatever handle it holds.
     *
     * @return the removed connection, empty if there was none
     */
    public Optional<ChargePointConnection> evict(String chargePointId) {
        Entry removed = entries.remove(chargePointId);
        return removed == null ? Optional.empty() : Optional.ofNullable(removed.connection());
    }

    /**
     * Records activity for a charge point.
     *
     * @return true if the charge point already had an entry, false if this call created it
     */
    public boolean touch(String chargePointId) {
        AtomicBoolean existed = new AtomicBoolean(true);
        Instant now = clock.instant();
        entries.compute(chargePointId, (id, current) -> {
            if (current == null) {
                existed.set(false);
                return new Entry(null, now);
            }
            return new Entry(current.connection(), now);
        });
        return existed.get();
    }

    /**
     * Adds an entry without a connection for a charge point that storage still reports as
     * online, so the liveness sweep measures its silence from the stored last activity.
     * An existing entry is left alone.
     *
     * @return true if the entry was added
     */
    public boolean restore(String chargePointId, Instant lastActivity) {
        Objects.requireNonNull(lastActivity, "lastActivity must not be null");
        return entries.putIfAbsent(chargePointId, new Entry(null, lastActivity)) == null;
    }

    public Optional<Instant> lastActivity(String chargePointId) {
        Entry entry = entries.get(chargePointId);
        return entry == null ? Optional.empty() : Optional.of(entry.lastActivity());
    }

    public boolean isConnected(String chargePointId) {
        return lookup(chargePointId).isPresent();
    }

    /**
     * Ids of all charge points currently considered online.
     */
    public Set<String> onlineChargePoints() {
        return Set.copyOf(entries.keySet());
    }

    public int connectedCount() {
        return (int) entries.values().stream()
            .filter(entry -> entry.connection() != null)
            .count();
    }

    private record Entry(ChargePointConnection connection, Instant lastActivity) {}
}
