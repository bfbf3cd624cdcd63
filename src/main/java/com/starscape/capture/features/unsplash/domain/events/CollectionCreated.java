package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Collection;

import java.time.Instant;
import java.util.Objects;

public record CollectionCreated(
    String collectionId,
    String curatorId,
    String title,
    boolean privateCollection,
    Instant createdAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.collection.created";

    public CollectionCreated {
        Objects.requireNonNull(collectionId, "collectionId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Collection.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return collectionId;
    }

    @Override
    public Instant getOccurredOn() {
        return createdAt;
    }
}
