package com.starscape.capture.features.pinterest.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record PinEngagementRequest(
    @NotNull(message = "repinCount is required")
    @PositiveOrZero(message = "repinCount cannot be negative")
    Long repinCount,
    @NotNull(message = "commentCount is required")
    @PositiveOrZero(message = "commentCount cannot be negative")
    Long commentCount
) {}
