package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotBlank;

public record InsightRequest(
    @NotBlank(message = "Insight text is required")
    String insight
) {}
