package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.Artist;
import com.starscape.capture.features.unsplash.domain.ArtistProfile;

import java.time.Instant;
import java.util.Objects;

public record ArtistProfileUpdated(
    String artistId,
    ArtistProfile oldProfile,
    ArtistProfile newProfile,
    Instant updatedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.artist.profile.updated";

    public ArtistProfileUpdated {
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
        return updatedAt;
    }
}
