package io.fullerstack.csms.model;

/**
 * Authorization verdict for an identity tag. Maps to OCPP 1.6 AuthorizationStatus.
 */
public enum Verdict {
    ACCEPTED,
    BLOCKED,
    EXPIRED,
    INVALID;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    public static Verdict fromOcpp(String value) {
        for (Verdict verdict : values()) {
            if (verdict.name().equalsIgnoreCase(value)) {
                return verdict;
            }
        }
        return INVALID;
    }
}
