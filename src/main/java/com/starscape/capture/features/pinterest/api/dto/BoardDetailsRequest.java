package com.starscape.capture.features.pinterest.api.dto;

import jakarta.validation.constraints.NotBlank;

public record BoardDetailsRequest(
    @NotBlank(message = "Board name is required")
    String name,
    String description
) {}
