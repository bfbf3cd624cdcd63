package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ReelEngagementRequest(
    @NotNull(message = "viewsCount is required")
    @PositiveOrZero(message = "viewsCount cannot be negative")
    Long viewsCount,
    @NotNull(message = "likesCount is required")
    @PositiveOrZero(message = "likesCount cannot be negative")
    Long likesCount,
    @NotNull(message = "commentsCount is required")
    @PositiveOrZero(message = "commentsCount cannot be negative")
    Long commentsCount
) {}
