package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;

/**
 * License terms. {@code type} defaults to free. Without {@code authorShare} the author receives all revenue;
 * the other shares default to zero.
 */
public record LicenseIssueRequest(
    String type,
    @NotBlank(message = "name is required")
    String name,
    String description,
    Boolean allowsCommercialUse,
    Boolean requiresAttribution,
    Boolean allowsModification,
    Boolean allowsDistribution,
    List<String> restrictions,
    Instant expiresAt,
    @Positive(message = "downloadLimit must be positive")
    Integer downloadLimit,
    String maxResolution,
    Integer authorShare,
    Integer platformShare,
    Integer affiliateShare,
    Integer charityShare
) {}
