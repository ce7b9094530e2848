package io.fullerstack.csms.connection;

import java.time.Instant;

/**
 * Demotes a silent charge point to offline.
 */
@FunctionalInterface
public interface OfflineTransition {

    /**
     * Demotes the charge point if it is still idle past the deadline at {@code now}.
     *
     * @return true if the charge point was demoted
     */
    boolean demoteIfIdle(String chargePointId, Instant now);
}
