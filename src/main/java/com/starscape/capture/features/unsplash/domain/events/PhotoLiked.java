package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Photo;

import java.time.Instant;
import java.util.Objects;

public record PhotoLiked(
    String photoId,
    String artistId,
    Instant likedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.photo.liked";

    public PhotoLiked {
        Objects.requireNonNull(photoId, "photoId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Photo.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return photoId;
    }

    @Override
    public Instant getOccurredOn() {
        return likedAt;
    }
}
