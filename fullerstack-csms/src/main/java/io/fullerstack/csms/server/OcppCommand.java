package io.fullerstack.csms.server;

import io.fullerstack.csms.model.Availability;

/**
 * A request sent from the central system to a charge point.
 * <p>
 * {@code commandId} is the correlation token generated when the command is created; the
 * transport pairs the charge point's reply with it.
 * </p>
 */
public sealed interface OcppCommand permits
    OcppCommand.RemoteStartTransaction,
    OcppCommand.RemoteStopTransaction,
    OcppCommand.ChangeAvailability,
    OcppCommand.Reset,
    OcppCommand.ChangeConfiguration,
    OcppCommand.ClearCache {

    String chargePointId();
    String commandId();

    /**
     * Remotely start a charging transaction. {@code connectorId} is optional.
     */
    record RemoteStartTransaction(
        String chargePointId,
        String commandId,
        Integer connectorId,
        String idTag
    ) implements OcppCommand {}

    /**
     * Remotely stop a charging transaction
     */
    record RemoteStopTransaction(
        String chargePointId,
        String commandId,
        int transactionId
    ) implements OcppCommand {}

    /**
     * Change the availability of a connector (0 = whole charge point)
     */
    record ChangeAvailability(
        String chargePointId,
        String commandId,
        int connectorId,
        Availability type
    ) implements OcppCommand {}

    /**
     * Reset the charge point
     */
    record Reset(
        String chargePointId,
        String commandId,
        Type type
    ) implements OcppCommand {

        public enum Type {
            SOFT,
            HARD
        }
    }

    /**
     * Change one configuration key on the charge point
     */
    record ChangeConfiguration(
        String chargePointId,
        String commandId,
        String key,
        String value
    ) implements OcppCommand {}

    /**
     * Clear the charge point's local authorization cache
     */
    record ClearCache(
        String chargePointId,
        String commandId
    ) implements OcppCommand {}
}
