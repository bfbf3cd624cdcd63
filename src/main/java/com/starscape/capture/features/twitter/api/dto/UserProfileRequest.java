package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

public record UserProfileRequest(
    @NotBlank(message = "username is required")
    String username,
    String displayName,
    String bio,
    String location,
    String website,
    String profileImageUrl,
    String bannerImageUrl,
    Instant joinedAt
) {}
