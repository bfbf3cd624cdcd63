package com.starscape.capture.features.instagram.app;

import com.starscape.capture.features.instagram.api.dto.PostCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.ReelCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.StoryCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserProfileRequest;
import com.starscape.capture.features.instagram.api.dto.UserStatsRequest;
import com.starscape.capture.features.instagram.domain.MediaType;
import com.starscape.capture.features.instagram.domain.PostMetadata;
import com.starscape.capture.features.instagram.domain.ReelAttributes;
import com.starscape.capture.features.instagram.domain.StoryAttributes;
import com.starscape.capture.features.instagram.domain.UserProfile;
import com.starscape.capture.features.instagram.domain.UserStats;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNullElse;

/**
 * Maps Instagram capture requests onto value objects. Absent counters start at zero.
 */
final class InstagramPayloads {

    private InstagramPayloads() {
    }

    static PostMetadata postMetadata(PostCaptureRequest request) {
        return new PostMetadata(
            request.caption(),
            request.imageUrl(),
            request.thumbnailUrl(),
            requireNonNullElse(request.likesCount(), 0L),
            requireNonNullElse(request.commentsCount(), 0L),
            request.hashtags(),
            request.location(),
            requireNonNullElse(request.timestamp(), Instant.now()),
            requireNonNullElse(request.video(), false),
            request.videoUrl()
        );
    }

    static ReelAttributes reelAttributes(ReelCaptureRequest request) {
        return new ReelAttributes(
            request.videoUrl(),
            request.thumbnailUrl(),
            requireNonNullElse(request.caption(), ""),
            request.duration(),
            requireNonNullElse(request.viewsCount(), 0L),
            requireNonNullElse(request.likesCount(), 0L),
            requireNonNullElse(request.commentsCount(), 0L),
            requireNonNullElse(request.sharesCount(), 0L),
            request.hashtags(),
            request.audioTrack(),
            requireNonNullElse(request.timestamp(), Instant.now())
        );
    }

    /**
     * Stories captured without an explicit {@code expiresAt} expire {@code defaultLifetime} after their timestamp.
     */
    static StoryAttributes storyAttributes(StoryCaptureRequest request, Duration defaultLifetime) {
        Instant timestamp = requireNonNullElse(request.timestamp(), Instant.now());
        return new StoryAttributes(
            request.mediaUrl(),
            MediaType.fromValue(request.mediaType()),
            request.duration(),
            timestamp,
            requireNonNullElse(request.expiresAt(), timestamp.plus(defaultLifetime))
        );
    }

    static UserProfile userProfile(UserCaptureRequest request) {
        return new UserProfile(request.username(), request.displayName(), request.bio(),
                request.profilePictureUrl(), request.website(), request.location());
    }

    static UserProfile userProfile(UserProfileRequest request) {
        return new UserProfile(request.username(), request.displayName(), request.bio(),
                request.profilePictureUrl(), request.website(), request.location());
    }

    static UserStats userStats(UserCaptureRequest request) {
        return new UserStats(
            requireNonNullElse(request.followersCount(), 0L),
            requireNonNullElse(request.followingCount(), 0L),
            requireNonNullElse(request.postsCount(), 0L)
        );
    }

    static UserStats userStats(UserStatsRequest request) {
        return new UserStats(request.followersCount(), request.followingCount(), request.postsCount());
    }
}
