package com.starscape.capture.features.twitter.app;

import com.starscape.capture.features.twitter.api.dto.EngagementMetricsRequest;
import com.starscape.capture.features.twitter.api.dto.TweetCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.UserCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.UserProfileRequest;
import com.starscape.capture.features.twitter.api.dto.UserStatsRequest;
import com.starscape.capture.features.twitter.domain.EngagementMetrics;
import com.starscape.capture.features.twitter.domain.TweetAttributes;
import com.starscape.capture.features.twitter.domain.TweetCounters;
import com.starscape.capture.features.twitter.domain.TwitterProfile;
import com.starscape.capture.features.twitter.domain.TwitterStats;

import java.time.Instant;

import static java.util.Objects.requireNonNullElse;

final class TwitterPayloads {

    private static final EngagementMetrics NO_METRICS = new EngagementMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private TwitterPayloads() {
    }

    static TweetAttributes tweetAttributes(TweetCaptureRequest request) {
        return new TweetAttributes(
            requireNonNullElse(request.content(), ""),
            request.mediaUrls(),
            request.hashtags(),
            request.mentions(),
            requireNonNullElse(request.createdAt(), Instant.now()),
            Boolean.TRUE.equals(request.retweet()),
            request.originalTweetId(),
            request.inReplyToTweetId(),
            Boolean.TRUE.equals(request.quoteTweet()),
            request.quotedTweetId(),
            request.language(),
            request.source()
        );
    }

    static TweetCounters tweetCounters(TweetCaptureRequest request) {
        return new TweetCounters(
            requireNonNullElse(request.retweetCount(), 0L),
            requireNonNullElse(request.likeCount(), 0L),
            requireNonNullElse(request.replyCount(), 0L),
            requireNonNullElse(request.quoteCount(), 0L),
            requireNonNullElse(request.viewCount(), 0L)
        );
    }

    static TwitterProfile profile(UserCaptureRequest request) {
        return new TwitterProfile(request.username(), request.displayName(), request.bio(), request.location(),
                request.website(), request.profileImageUrl(), request.bannerImageUrl(), request.joinedAt());
    }

    static TwitterProfile profile(UserProfileRequest request) {
        return new TwitterProfile(request.username(), request.displayName(), request.bio(), request.location(),
                request.website(), request.profileImageUrl(), request.bannerImageUrl(), request.joinedAt());
    }

    static TwitterStats stats(UserCaptureRequest request) {
        return new TwitterStats(
            requireNonNullElse(request.followersCount(), 0L),
            requireNonNullElse(request.followingCount(), 0L),
            requireNonNullElse(request.tweetsCount(), 0L),
            requireNonNullElse(request.listedCount(), 0L)
        );
    }

    static TwitterStats stats(UserStatsRequest request) {
        return new TwitterStats(request.followersCount(), request.followingCount(),
                request.tweetsCount(), request.listedCount());
    }

    static EngagementMetrics metrics(EngagementMetricsRequest request) {
        return request != null ? mergeMetrics(NO_METRICS, request) : NO_METRICS;
    }

    /**
     * Counters absent from {@code request} keep their current value.
     */
    static EngagementMetrics mergeMetrics(EngagementMetrics current, EngagementMetricsRequest request) {
        return new EngagementMetrics(
            requireNonNullElse(request.impressions(), current.impressions()),
            requireNonNullElse(request.engagements(), current.engagements()),
            requireNonNullElse(request.likes(), current.likes()),
            requireNonNullElse(request.retweets(), current.retweets()),
            requireNonNullElse(request.replies(), current.replies()),
            requireNonNullElse(request.quotes(), current.quotes()),
            requireNonNullElse(request.profileClicks(), current.profileClicks()),
            requireNonNullElse(request.urlClicks(), current.urlClicks()),
            requireNonNullElse(request.hashtagClicks(), current.hashtagClicks()),
            requireNonNullElse(request.detailExpands(), current.detailExpands()),
            requireNonNullElse(request.mediaViews(), current.mediaViews()),
            requireNonNullElse(request.mediaEngagements(), current.mediaEngagements())
        );
    }
}
