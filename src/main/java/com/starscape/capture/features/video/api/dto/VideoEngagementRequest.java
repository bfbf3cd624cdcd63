package com.starscape.capture.features.video.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record VideoEngagementRequest(
    @NotNull(message = "viewCount is required")
    @PositiveOrZero(message = "viewCount cannot be negative")
    Long viewCount,
    @NotNull(message = "likeCount is required")
    @PositiveOrZero(message = "likeCount cannot be negative")
    Long likeCount
) {}
