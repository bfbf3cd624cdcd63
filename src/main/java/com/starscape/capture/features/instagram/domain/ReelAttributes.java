package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;
import java.util.List;

public record ReelAttributes(
    String videoUrl,
    String thumbnailUrl,
    String caption,
    int durationSeconds,
    long viewsCount,
    long likesCount,
    long commentsCount,
    long sharesCount,
    List<String> hashtags,
    String audioTrack,
    Instant timestamp
) implements ValueObject {

    public ReelAttributes {
        Guard.requireNonBlank("videoUrl", videoUrl);
        Guard.requireNonBlank("thumbnailUrl", thumbnailUrl);
        caption = caption == null ? "" : caption;
        Guard.requirePositive("durationSeconds", durationSeconds);
        Guard.requireNonNegative("viewsCount", viewsCount);
        Guard.requireNonNegative("likesCount", likesCount);
        Guard.requireNonNegative("commentsCount", commentsCount);
        Guard.requireNonNegative("sharesCount", sharesCount);
        hashtags = Guard.copyOf("hashtags", hashtags);
        Guard.requireNonNull("timestamp", timestamp);
    }

    public ReelAttributes withEngagement(long viewsCount, long likesCount, long commentsCount) {
        return new ReelAttributes(videoUrl, thumbnailUrl, caption, durationSeconds, viewsCount, likesCount,
                commentsCount, sharesCount, hashtags, audioTrack, timestamp);
    }

    public ReelAttributes withShares(long sharesCount) {
        return new ReelAttributes(videoUrl, thumbnailUrl, caption, durationSeconds, viewsCount, likesCount,
                commentsCount, sharesCount, hashtags, audioTrack, timestamp);
    }

    public ReelAttributes withHashtags(List<String> hashtags) {
        return new ReelAttributes(videoUrl, thumbnailUrl, caption, durationSeconds, viewsCount, likesCount,
                commentsCount, sharesCount, hashtags, audioTrack, timestamp);
    }
}
