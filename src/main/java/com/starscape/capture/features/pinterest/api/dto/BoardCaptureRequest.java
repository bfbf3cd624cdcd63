package com.starscape.capture.features.pinterest.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record BoardCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "name is required")
    String name,
    String description,
    @NotBlank(message = "ownerId is required")
    String ownerId,
    @JsonProperty("isPrivate") Boolean privateBoard
) {}
