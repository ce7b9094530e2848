package io.fullerstack.csms.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An identity tag (RFID card or similar) as stored by the central system.
 *
 * @param tag        tag identifier presented by the user
 * @param status     stored status of the tag itself
 * @param expiryDate optional instant after which the tag is expired
 * @param parentTag  optional parent tag whose blocking/expiry decision this tag inherits
 */
public record IdTag(
    String tag,
    Verdict status,
    Instant expiryDate,
    String parentTag
) {
    public IdTag {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static IdTag accepted(String tag) {
        return new IdTag(tag, Verdict.ACCEPTED, null, null);
    }

    public boolean isExpiredAt(Instant now) {
        return expiryDate != null && expiryDate.isBefore(now);
    }

    public boolean hasParent() {
        return parentTag != null && !parentTag.isBlank();
    }
}
