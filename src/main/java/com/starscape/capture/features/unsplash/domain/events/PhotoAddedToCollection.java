package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Collection;

import java.time.Instant;
import java.util.Objects;

public record PhotoAddedToCollection(
    String collectionId,
    String photoId,
    String curatorId,
    Instant addedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.photo.added.to.collection";

    public PhotoAddedToCollection {
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
        return addedAt;
    }
}
