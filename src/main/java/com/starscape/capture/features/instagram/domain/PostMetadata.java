package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;
import com.starscape.capture.common.exception.ValidationException;

import java.time.Instant;
import java.util.List;

/**
 * Attributes of a captured post. A video post must carry its video url.
 */
public record PostMetadata(
    String caption,
    String imageUrl,
    String thumbnailUrl,
    long likesCount,
    long commentsCount,
    List<String> hashtags,
    String location,
    Instant timestamp,
    boolean video,
    String videoUrl
) implements ValueObject {

    public PostMetadata {
        Guard.requireNonBlank("caption", caption);
        Guard.requireNonBlank("imageUrl", imageUrl);
        Guard.requireNonNegative("likesCount", likesCount);
        Guard.requireNonNegative("commentsCount", commentsCount);
        hashtags = Guard.copyOf("hashtags", hashtags);
        Guard.requireNonNull("timestamp", timestamp);
        if (video && (videoUrl == null || videoUrl.isBlank())) {
            throw new ValidationException("videoUrl", "videoUrl is required for video posts");
        }
    }

    public PostMetadata withEngagement(long likesCount, long commentsCount) {
        return new PostMetadata(caption, imageUrl, thumbnailUrl, likesCount, commentsCount,
                hashtags, location, timestamp, video, videoUrl);
    }

    /**
     * Url the download consumer should fetch.
     */
    public String mediaUrl() {
        return video ? videoUrl : imageUrl;
    }
}
