package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Thread;

import java.time.Instant;
import java.util.Objects;

/**
 * Recorded by the thread, so the aggregate id is the thread id.
 */
public record TweetAddedToThread(
    String threadId,
    String tweetId,
    String authorId,
    int position,
    Instant addedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.tweet.added.to.thread";

    public TweetAddedToThread {
        Objects.requireNonNull(threadId, "threadId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Thread.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return threadId;
    }

    @Override
    public Instant getOccurredOn() {
        return addedAt;
    }
}
