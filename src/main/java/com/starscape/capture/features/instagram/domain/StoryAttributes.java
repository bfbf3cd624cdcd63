package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;
import com.starscape.capture.common.exception.ValidationException;

import java.time.Instant;

/**
 * Attributes of a captured story. {@code durationSeconds} is only meaningful for video stories.
 */
public record StoryAttributes(
    String mediaUrl,
    MediaType mediaType,
    Integer durationSeconds,
    Instant timestamp,
    Instant expiresAt
) implements ValueObject {

    public StoryAttributes {
        Guard.requireNonBlank("mediaUrl", mediaUrl);
        Guard.requireNonNull("mediaType", mediaType);
        if (durationSeconds != null) {
            Guard.requirePositive("durationSeconds", durationSeconds);
        }
        Guard.requireNonNull("timestamp", timestamp);
        Guard.requireNonNull("expiresAt", expiresAt);
        if (!expiresAt.isAfter(timestamp)) {
            throw new ValidationException("expiresAt", "expiresAt must be after timestamp");
        }
    }
}
