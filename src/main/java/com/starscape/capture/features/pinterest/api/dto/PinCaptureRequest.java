package com.starscape.capture.features.pinterest.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

/**
 * Pin as scraped from the page. {@code boardId}, when present, assigns the pin to that board.
 */
public record PinCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    String boardId,
    @NotBlank(message = "title is required")
    String title,
    String description,
    @NotBlank(message = "imageUrl is required")
    String imageUrl,
    @NotBlank(message = "originalImageUrl is required")
    String originalImageUrl,
    String sourceUrl,
    @NotNull(message = "width is required")
    Integer width,
    @NotNull(message = "height is required")
    Integer height,
    Instant createdAt,
    @NotBlank(message = "creatorId is required")
    String creatorId,
    String creatorName,
    String boardName,
    @PositiveOrZero Long repinCount,
    @PositiveOrZero Long commentCount,
    List<String> tags
) {}
