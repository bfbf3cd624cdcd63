package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record PhotoEngagementRequest(
    @NotNull(message = "likes is required") @PositiveOrZero Long likes,
    @NotNull(message = "downloads is required") @PositiveOrZero Long downloads
) {}
