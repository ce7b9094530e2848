package io.fullerstack.csms.model;

import java.time.Instant;

/**
 * A vendor-specific DataTransfer payload, stored verbatim for later inspection.
 */
public record DataTransfer(
    String chargePointId,
    String vendorId,
    String messageId,
    String data,
    Instant timestamp
) {}
