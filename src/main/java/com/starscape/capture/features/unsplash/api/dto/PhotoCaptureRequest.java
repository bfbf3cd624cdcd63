package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

public record PhotoCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "artistId is required")
    String artistId,
    String title,
    String description,
    @NotBlank(message = "url is required")
    String url,
    @NotBlank(message = "downloadUrl is required")
    String downloadUrl,
    @NotBlank(message = "thumbnailUrl is required")
    String thumbnailUrl,
    @NotNull(message = "width is required")
    Integer width,
    @NotNull(message = "height is required")
    Integer height,
    String color,
    @PositiveOrZero Long likes,
    @PositiveOrZero Long downloads,
    List<String> tags,
    Instant createdAt
) {}
