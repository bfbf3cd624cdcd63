package com.starscape.capture.features.unsplash.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CollectionCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "curatorId is required")
    String curatorId,
    @NotBlank(message = "title is required")
    String title,
    String description,
    List<String> tags,
    @JsonProperty("isPrivate") Boolean privateCollection
) {}
