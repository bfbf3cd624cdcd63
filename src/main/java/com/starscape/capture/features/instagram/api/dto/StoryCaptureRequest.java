package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

/**
 * Without {@code expiresAt} the story expires the configured lifetime after {@code timestamp}.
 */
public record StoryCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "authorId is required")
    String authorId,
    @NotBlank(message = "mediaUrl is required")
    String mediaUrl,
    @NotBlank(message = "mediaType is required")
    String mediaType,
    Integer duration,
    Instant timestamp,
    Instant expiresAt
) {}
