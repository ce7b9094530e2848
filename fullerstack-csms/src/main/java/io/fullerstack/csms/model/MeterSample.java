package io.fullerstack.csms.model;

import java.time.Instant;

/**
 * A single sampled meter value. Append-only.
 * <p>
 * {@code transactionId} is {@code null} for an orphaned sample, i.e. one that arrived while
 * no session was active on the connector. Orphaned samples are kept for audit.
 * </p>
 */
public record MeterSample(
    Integer transactionId,
    String chargePointId,
    int connectorId,
    Instant timestamp,
    double value,
    String measurand,
    String unit
) {
    public static final String DEFAULT_MEASURAND = "Energy.Active.Import.Register";
    public static final String DEFAULT_UNIT = "Wh";

    public boolean isOrphaned() {
        return transactionId == null;
    }
}
