package com.starscape.capture.features.twitter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ThreadCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "authorId is required")
    String authorId,
    String title,
    String description,
    @JsonProperty("isPrivate") Boolean privateThread
) {}
