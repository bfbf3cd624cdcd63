package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Tweet;
import com.starscape.capture.features.twitter.domain.TweetAttributes;
import com.starscape.capture.features.twitter.domain.TweetCounters;

import java.time.Instant;
import java.util.Objects;

public record TweetSaved(
    String tweetId,
    String authorId,
    String threadId,
    TweetAttributes attributes,
    TweetCounters counters,
    Instant savedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.tweet.saved";

    public TweetSaved {
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
        return savedAt;
    }
}
