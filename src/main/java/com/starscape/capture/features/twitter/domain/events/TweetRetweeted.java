package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Tweet;

import java.time.Instant;
import java.util.Objects;

public record TweetRetweeted(
    String tweetId,
    String authorId,
    long retweetCount,
    Instant retweetedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.tweet.retweeted";

    public TweetRetweeted {
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
        return retweetedAt;
    }
}
