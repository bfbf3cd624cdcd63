package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Latest counters read from the page. Both are required; a refresh replaces them.
 */
public record PostEngagementRequest(
    @NotNull(message = "likesCount is required")
    @PositiveOrZero(message = "likesCount cannot be negative")
    Long likesCount,
    @NotNull(message = "commentsCount is required")
    @PositiveOrZero(message = "commentsCount cannot be negative")
    Long commentsCount
) {}
