package com.starscape.capture.features.video.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.video.domain.Playlist;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record PlaylistSynced(
    String playlistId,
    List<String> videoIds,
    Instant syncedAt
) implements DomainEvent {

    public static final String TYPE = "playlist.synced";

    public PlaylistSynced {
        Objects.requireNonNull(playlistId, "playlistId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Playlist.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return playlistId;
    }

    @Override
    public Instant getOccurredOn() {
        return syncedAt;
    }
}
