package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;
import java.util.List;

/**
 * Terms a license is issued under. {@code expiresAt} and {@code downloadLimit} are optional;
 * absent means unbounded.
 */
public record LicenseTerms(
    LicenseType type,
    String name,
    String description,
    boolean allowsCommercialUse,
    boolean requiresAttribution,
    boolean allowsModification,
    boolean allowsDistribution,
    List<String> restrictions,
    Instant expiresAt,
    Integer downloadLimit,
    String maxResolution,
    RevenueModel revenueModel
) implements ValueObject {

    public LicenseTerms {
        Guard.requireNonNull("type", type);
        Guard.requireNonBlank("name", name);
        description = description == null ? "" : description;
        restrictions = Guard.copyOf("restrictions", restrictions);
        if (downloadLimit != null) {
            Guard.requirePositive("downloadLimit", downloadLimit);
        }
        revenueModel = revenueModel == null ? RevenueModel.authorOnly() : revenueModel;
    }
}
