package io.fullerstack.csms.model;

/**
 * Availability of a connector as set through ChangeAvailability.
 */
public enum Availability {
    OPERATIVE("Operative"),
    INOPERATIVE("Inoperative");

    private final String ocppValue;

    Availability(String ocppValue) {
        this.ocppValue = ocppValue;
    }

    /**
     * The value used on the wire, e.g. "Inoperative".
     */
    public String ocppValue() {
        return ocppValue;
    }

    public static Availability fromOcpp(String value) {
        for (Availability availability : values()) {
            if (availability.ocppValue.equalsIgnoreCase(value)) {
                return availability;
            }
        }
        throw new IllegalArgumentException("Unknown availability type: " + value);
    }
}
