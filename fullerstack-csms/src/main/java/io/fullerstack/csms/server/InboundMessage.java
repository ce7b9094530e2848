package io.fullerstack.csms.server;

import io.fullerstack.csms.model.Availability;
import io.fullerstack.csms.model.ConnectorStatus;

import java.time.Instant;
import java.util.List;

/**
 * A decoded request received from a charge point.
 * <p>
 * The closed set of variants is the set of charge-point-initiated messages the central system
 * handles. Each variant names the response type the session coordinator produces for it.
 * </p>
 *
 * @param <R> response type for this message
 */
public sealed interface InboundMessage<R extends InboundResponse> permits
    InboundMessage.BootNotification,
    InboundMessage.Heartbeat,
    InboundMessage.Authorize,
    InboundMessage.StatusNotification,
    InboundMessage.StartTransaction,
    InboundMessage.StopTransaction,
    InboundMessage.MeterValues,
    InboundMessage.DataTransfer {

    String chargePointId();

    /**
     * BootNotification - charge point (re)started and registers with the central system
     */
    record BootNotification(
        String chargePointId,
        String vendor,
        String model,
        String serialNumber,
        String firmwareVersion
    ) implements InboundMessage<InboundResponse.Boot> {}

    /**
     * Heartbeat - periodic keep-alive
     */
    record Heartbeat(
        String chargePointId
    ) implements InboundMessage<InboundResponse.Heartbeat> {}

    /**
     * Authorize - is this tag allowed to charge?
     */
    record Authorize(
        String chargePointId,
        String idTag
    ) implements InboundMessage<InboundResponse.Authorize> {}

    /**
     * StatusNotification - connector status changed. {@code availability} is null when the
     * report does not imply an availability change.
     */
    record StatusNotification(
        String chargePointId,
        int connectorId,
        ConnectorStatus status,
        Availability availability,
        String errorCode,
        String info,
        Instant timestamp
    ) implements InboundMessage<InboundResponse.Acknowledged> {}

    /**
     * StartTransaction - the charge point wants to start delivering energy
     */
    record StartTransaction(
        String chargePointId,
        int connectorId,
        String idTag,
        long meterStart,
        Instant timestamp
    ) implements InboundMessage<InboundResponse.StartTransaction> {}

    /**
     * StopTransaction - energy delivery ended
     */
    record StopTransaction(
        String chargePointId,
        int transactionId,
        String idTag,
        long meterStop,
        Instant timestamp,
        String reason
    ) implements InboundMessage<InboundResponse.Acknowledged> {}

    /**
     * MeterValues - periodic samples; {@code transactionId} is optional
     */
    record MeterValues(
        String chargePointId,
        int connectorId,
        Integer transactionId,
        List<SampledValue> samples
    ) implements InboundMessage<InboundResponse.Acknowledged> {

        public MeterValues {
            samples = List.copyOf(samples);
        }
    }

    /**
     * DataTransfer - vendor-specific payload, stored verbatim
     */
    record DataTransfer(
        String chargePointId,
        String vendorId,
        String messageId,
        String data
    ) implements InboundMessage<InboundResponse.Acknowledged> {}

    /**
     * One sampled value inside a MeterValues message.
     */
    record SampledValue(
        Instant timestamp,
        double value,
        String measurand,
        String unit
    ) {}
}
