package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Thread;

import java.time.Instant;
import java.util.Objects;

public record ThreadCreated(
    String threadId,
    String authorId,
    String title,
    String description,
    boolean privateThread,
    Instant createdAt
) implements DomainEvent {

    public static final String TYPE = "twitter.thread.created";

    public ThreadCreated {
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
        return createdAt;
    }
}
