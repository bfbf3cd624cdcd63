package com.starscape.capture.features.unsplash.api.dto;

/**
 * Response DTO after a license was used; {@code downloadLimit} is null for unlimited licenses.
 */
public record LicenseUsageResponse(
    String licenseId,
    int usageCount,
    Integer downloadLimit
) {}
