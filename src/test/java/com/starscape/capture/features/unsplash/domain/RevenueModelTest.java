package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RevenueModelTest {

    @Test
    void sharesMustSumToExactlyOneHundred() {
        assertEquals("revenueModel",
                assertThrows(ValidationException.class, () -> new RevenueModel(70, 20, 5, 4)).getField());
        assertEquals("revenueModel",
                assertThrows(ValidationException.class, () -> new RevenueModel(70, 20, 5, 6)).getField());
        assertEquals(70, new RevenueModel(70, 20, 5, 5).authorShare());
    }

    @Test
    void eachShareStaysWithinBounds() {
        ValidationException ex = assertThrows(ValidationException.class, () -> new RevenueModel(110, -10, 0, 0));
        assertEquals("authorShare", ex.getField());
    }

    @Test
    void missingModelDefaultsToAuthorOnly() {
        LicenseTerms terms = new LicenseTerms(LicenseType.FREE, "Unsplash License", null, true, false, true, true,
                null, null, null, null, null);
        assertEquals(RevenueModel.authorOnly(), terms.revenueModel());
    }
}
