package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Artist;

import java.time.Instant;
import java.util.Objects;

public record ArtistFollowed(
    String artistId,
    String username,
    Instant followedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.artist.followed";

    public ArtistFollowed {
        Objects.requireNonNull(artistId, "artistId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Artist.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return artistId;
    }

    @Override
    public Instant getOccurredOn() {
        return followedAt;
    }
}
