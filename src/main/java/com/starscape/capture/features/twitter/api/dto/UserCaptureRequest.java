package com.starscape.capture.features.twitter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

public record UserCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "username is required")
    String username,
    String displayName,
    String bio,
    String location,
    String website,
    String profileImageUrl,
    String bannerImageUrl,
    Instant joinedAt,
    @PositiveOrZero Long followersCount,
    @PositiveOrZero Long followingCount,
    @PositiveOrZero Long tweetsCount,
    @PositiveOrZero Long listedCount,
    @JsonProperty("isVerified") Boolean verified,
    @JsonProperty("isProtected") Boolean protectedAccount
) {}
