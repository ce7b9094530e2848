package io.fullerstack.csms.session;

import java.util.Locale;

/**
 * Outcome of a centrally-initiated command.
 * <p>
 * The first five values are the charge point's own answers; the rest are decided by the
 * central system without (or instead of) a device answer.
 * </p>
 */
public enum CommandStatus {
    ACCEPTED,
    REJECTED,
    SCHEDULED,
    REBOOT_REQUIRED,
    NOT_SUPPORTED,

    /**
     * Referenced transaction does not exist or is not active
     */
    NOT_FOUND,

    /**
     * No live connection for the charge point
     */
    UNREACHABLE,

    /**
     * Another command to the same charge point is still pending
     */
    BUSY,

    /**
     * Sent, but no correlated reply before the deadline
     */
    TIMEOUT,

    /**
     * Could not be sent, or no usable reply came back
     */
    FAILED;

    /**
     * Maps a status value as sent by the charge point ("Accepted", "RebootRequired", ...).
     *
     * @return the matching status, or {@link #FAILED} for anything unrecognised
     */
    public static CommandStatus fromReply(String value) {
        if (value == null) {
            return FAILED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "accepted" -> ACCEPTED;
            case "rejected" -> REJECTED;
            case "scheduled" -> SCHEDULED;
            case "rebootrequired" -> REBOOT_REQUIRED;
            case "notsupported" -> NOT_SUPPORTED;
            default -> FAILED;
        };
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
