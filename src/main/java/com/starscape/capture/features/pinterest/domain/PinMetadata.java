package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;
import java.util.List;

public record PinMetadata(
    String title,
    String description,
    String imageUrl,
    String originalImageUrl,
    String sourceUrl,
    int width,
    int height,
    Instant createdAt,
    String creatorId,
    String creatorName,
    String boardName,
    long repinCount,
    long commentCount,
    List<String> tags
) implements ValueObject {

    private static final double SQUARE_TOLERANCE = 0.01;

    public PinMetadata {
        Guard.requireNonBlank("title", title);
        description = description == null ? "" : description;
        Guard.requireNonBlank("imageUrl", imageUrl);
        Guard.requireNonBlank("originalImageUrl", originalImageUrl);
        Guard.requirePositive("width", width);
        Guard.requirePositive("height", height);
        Guard.requireNonNull("createdAt", createdAt);
        Guard.requireNonBlank("creatorId", creatorId);
        Guard.requireNonNegative("repinCount", repinCount);
        Guard.requireNonNegative("commentCount", commentCount);
        tags = Guard.copyOf("tags", tags);
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    public Orientation orientation() {
        double ratio = aspectRatio();
        if (Math.abs(ratio - 1) < SQUARE_TOLERANCE) {
            return Orientation.SQUARE;
        }
        return ratio > 1 ? Orientation.LANDSCAPE : Orientation.PORTRAIT;
    }

    public PinMetadata withEngagement(long repinCount, long commentCount) {
        return new PinMetadata(title, description, imageUrl, originalImageUrl, sourceUrl, width, height,
                createdAt, creatorId, creatorName, boardName, repinCount, commentCount, tags);
    }
}
