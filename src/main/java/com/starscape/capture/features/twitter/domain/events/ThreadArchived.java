package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Thread;

import java.time.Instant;
import java.util.Objects;

public record ThreadArchived(
    String threadId,
    String authorId,
    Instant archivedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.thread.archived";

    public ThreadArchived {
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
        return archivedAt;
    }
}
