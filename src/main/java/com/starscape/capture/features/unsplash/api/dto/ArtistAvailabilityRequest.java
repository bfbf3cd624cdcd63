package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotNull;

public record ArtistAvailabilityRequest(
    @NotNull(message = "forHire is required")
    Boolean forHire,
    @NotNull(message = "acceptsDonations is required")
    Boolean acceptsDonations
) {}
