package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Collection;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record CollectionSynced(
    String collectionId,
    String curatorId,
    List<String> photoIds,
    Instant syncedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.collection.synced";

    public CollectionSynced {
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
        return syncedAt;
    }
}
