package com.starscape.capture.features.instagram.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

public record PostCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "authorId is required")
    String authorId,
    @NotBlank(message = "caption is required")
    String caption,
    @NotBlank(message = "imageUrl is required")
    String imageUrl,
    String thumbnailUrl,
    @PositiveOrZero Long likesCount,
    @PositiveOrZero Long commentsCount,
    List<String> hashtags,
    String location,
    Instant timestamp,
    @JsonProperty("isVideo") Boolean video,
    String videoUrl
) {}
