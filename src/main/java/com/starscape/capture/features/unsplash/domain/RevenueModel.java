package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.ValueObject;
import com.starscape.capture.common.exception.ValidationException;

/**
 * Split of license revenue, in whole percent. The four shares always add up to exactly 100.
 */
public record RevenueModel(
    int authorShare,
    int platformShare,
    int affiliateShare,
    int charityShare
) implements ValueObject {

    public static final int TOTAL = 100;

    public RevenueModel {
        requireShare("authorShare", authorShare);
        requireShare("platformShare", platformShare);
        requireShare("affiliateShare", affiliateShare);
        requireShare("charityShare", charityShare);
        int sum = authorShare + platformShare + affiliateShare + charityShare;
        if (sum != TOTAL) {
            throw new ValidationException("revenueModel", "Revenue shares must sum to 100, got " + sum);
        }
    }

    public static RevenueModel authorOnly() {
        return new RevenueModel(TOTAL, 0, 0, 0);
    }

    private static void requireShare(String field, int share) {
        if (share < 0 || share > TOTAL) {
            throw new ValidationException(field, field + " must be between 0 and 100");
        }
    }
}
