package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ArtistProfileRequest(
    @NotBlank(message = "username is required")
    String username,
    String firstName,
    String lastName,
    String bio,
    String location,
    String portfolioUrl,
    String instagramUsername,
    String twitterUsername,
    String profileImageUrl
) {}
