package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Tweet;

import java.time.Instant;
import java.util.Objects;

public record TweetLiked(
    String tweetId,
    String authorId,
    long likeCount,
    Instant likedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.tweet.liked";

    public TweetLiked {
        Objects.requireNonNull(tweetId, "tweetId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Tweet.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return tweetId;
    }

    @Override
    public Instant getOccurredOn() {
        return likedAt;
    }
}
