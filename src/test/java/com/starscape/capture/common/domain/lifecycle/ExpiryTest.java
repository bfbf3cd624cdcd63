package com.starscape.capture.common.domain.lifecycle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryTest {

    @Test
    void neverExpiresWithoutInstant() {
        assertFalse(Expiry.at(null).isExpired());
    }

    @Test
    void expiryIsEvaluatedAgainstGivenClock() {
        Instant expiresAt = Instant.parse("2024-01-01T00:00:00Z");
        Expiry expiry = Expiry.at(expiresAt);

        assertFalse(expiry.isExpiredAt(expiresAt.minus(Duration.ofMinutes(1))));
        assertFalse(expiry.isExpiredAt(expiresAt));
        assertTrue(expiry.isExpiredAt(expiresAt.plusSeconds(1)));
        assertTrue(expiry.isExpired());
    }
}
