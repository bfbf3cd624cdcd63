package com.starscape.capture.common.domain.lifecycle;

import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;

/**
 * Optional expiration instant; null never expires. Recomputed against the clock on every call.
 */
public record Expiry(Instant expiresAt) implements ValueObject {

    public static Expiry at(Instant expiresAt) {
        return new Expiry(expiresAt);
    }

    public boolean isExpired() {
        return isExpiredAt(Instant.now());
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
