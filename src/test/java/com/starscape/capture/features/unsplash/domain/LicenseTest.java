package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.ExpiredContentException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.unsplash.domain.events.LicenseUsed;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LicenseTest {

    private static License license(Instant expiresAt, Integer downloadLimit) {
        LicenseTerms terms = new LicenseTerms(LicenseType.PLUS, "Plus", null, true, false, true, false,
                null, expiresAt, downloadLimit, "full", new RevenueModel(70, 20, 5, 5));
        return License.issue(PhotoId.of("abc"), ArtistId.of("artist-1"), terms);
    }

    @Test
    void idCombinesPhotoAndArtist() {
        License license = license(null, null);
        assertEquals("abc/artist-1", license.getId().value());
        assertEquals(license.getId(), LicenseId.parse("abc/artist-1"));
        assertTrue(license.getDomainEvents().isEmpty());
    }

    @Test
    void useRequiresAcquisition() {
        License license = license(null, null);
        InvalidStateException ex = assertThrows(InvalidStateException.class, license::use);
        assertEquals("LICENSE_NOT_ACQUIRED", ex.getCode());
    }

    @Test
    void acquireOnlyOnce() {
        License license = license(null, null);
        license.acquire();
        assertThrows(AlreadyExistsException.class, license::acquire);
    }

    @Test
    void useStopsAtDownloadLimit() {
        License license = license(null, 2);
        license.acquire();
        license.use();
        license.use();
        license.pullDomainEvents();

        InvalidStateException ex = assertThrows(InvalidStateException.class, license::use);
        assertEquals("USAGE_LIMIT_REACHED", ex.getCode());
        assertEquals(2, license.getUsageCount());
        assertTrue(license.pullDomainEvents().isEmpty());
    }

    @Test
    void useRecordsUsageCount() {
        License license = license(null, null);
        license.acquire();
        license.pullDomainEvents();

        license.use();

        LicenseUsed used = assertInstanceOf(LicenseUsed.class, license.pullDomainEvents().get(0));
        assertEquals(1, used.usageCount());
    }

    @Test
    void expiredLicenseCannotBeUsed() {
        License license = license(Instant.now().minusSeconds(60), null);
        license.acquire();
        assertThrows(ExpiredContentException.class, license::use);
    }
}
