package com.starscape.capture.features.instagram.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record UserCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "username is required")
    String username,
    String displayName,
    String bio,
    String profilePictureUrl,
    String website,
    String location,
    @PositiveOrZero Long followersCount,
    @PositiveOrZero Long followingCount,
    @PositiveOrZero Long postsCount,
    @JsonProperty("isVerified") Boolean verified,
    @JsonProperty("isPrivate") Boolean privateAccount
) {}
