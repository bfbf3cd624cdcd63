package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record UserStatsRequest(
    @NotNull(message = "followersCount is required")
    @PositiveOrZero(message = "followersCount cannot be negative")
    Long followersCount,
    @NotNull(message = "followingCount is required")
    @PositiveOrZero(message = "followingCount cannot be negative")
    Long followingCount,
    @NotNull(message = "postsCount is required")
    @PositiveOrZero(message = "postsCount cannot be negative")
    Long postsCount
) {}
