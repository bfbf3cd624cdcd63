package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record UserStatsRequest(
    @NotNull(message = "followersCount is required")
    @PositiveOrZero(message = "followersCount cannot be negative")
    Long followersCount,
    @NotNull(message = "followingCount is required")
    @PositiveOrZero(message = "followingCount cannot be negative")
    Long followingCount,
    @NotNull(message = "tweetsCount is required")
    @PositiveOrZero(message = "tweetsCount cannot be negative")
    Long tweetsCount,
    @NotNull(message = "listedCount is required")
    @PositiveOrZero(message = "listedCount cannot be negative")
    Long listedCount
) {}
