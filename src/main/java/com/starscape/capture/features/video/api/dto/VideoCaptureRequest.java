package com.starscape.capture.features.video.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

/**
 * Video as captured. {@code duration} is in seconds; {@code quality} is a label such as {@code 720p}
 * or a quality name and defaults to HIGH.
 */
public record VideoCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "title is required")
    String title,
    String description,
    @PositiveOrZero(message = "duration cannot be negative")
    Long duration,
    Instant publishedAt,
    @NotBlank(message = "channelId is required")
    String channelId,
    String channelTitle,
    String thumbnailUrl,
    @PositiveOrZero Long viewCount,
    @PositiveOrZero Long likeCount,
    List<String> tags,
    String quality
) {}
