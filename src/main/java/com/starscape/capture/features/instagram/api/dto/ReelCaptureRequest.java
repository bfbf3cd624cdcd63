package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

public record ReelCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "authorId is required")
    String authorId,
    @NotBlank(message = "videoUrl is required")
    String videoUrl,
    @NotBlank(message = "thumbnailUrl is required")
    String thumbnailUrl,
    String caption,
    @NotNull(message = "duration is required")
    Integer duration,
    @PositiveOrZero Long viewsCount,
    @PositiveOrZero Long likesCount,
    @PositiveOrZero Long commentsCount,
    @PositiveOrZero Long sharesCount,
    List<String> hashtags,
    String audioTrack,
    Instant timestamp
) {}
