package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;
import java.util.List;

public record VideoMetadata(
    String title,
    String description,
    long durationSeconds,
    Instant publishedAt,
    ChannelId channelId,
    String channelTitle,
    String thumbnailUrl,
    long viewCount,
    long likeCount,
    List<String> tags
) implements ValueObject {

    public VideoMetadata {
        Guard.requireNonBlank("title", title);
        description = description == null ? "" : description;
        Guard.requireNonNegative("duration", durationSeconds);
        Guard.requireNonNull("publishedAt", publishedAt);
        Guard.requireNonNull("channelId", channelId);
        Guard.requireNonNegative("viewCount", viewCount);
        Guard.requireNonNegative("likeCount", likeCount);
        tags = Guard.copyOf("tags", tags);
    }

    /**
     * {@code m:ss}, or {@code h:mm:ss} for videos of an hour or more.
     */
    public String formattedDuration() {
        long hours = durationSeconds / 3600;
        long minutes = (durationSeconds % 3600) / 60;
        long seconds = durationSeconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format("%d:%02d", minutes, seconds);
    }

    public VideoMetadata withEngagement(long viewCount, long likeCount) {
        return new VideoMetadata(title, description, durationSeconds, publishedAt, channelId, channelTitle,
                thumbnailUrl, viewCount, likeCount, tags);
    }
}
