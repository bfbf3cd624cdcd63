package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotBlank;

public record UserProfileRequest(
    @NotBlank(message = "username is required")
    String username,
    String displayName,
    String bio,
    String profilePictureUrl,
    String website,
    String location
) {}
