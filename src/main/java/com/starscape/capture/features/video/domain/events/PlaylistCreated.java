package com.starscape.capture.features.video.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.video.domain.Playlist;

import java.time.Instant;
import java.util.Objects;

public record PlaylistCreated(
    String playlistId,
    String title,
    String channelId,
    boolean publicPlaylist,
    Instant createdAt
) implements DomainEvent {

    public static final String TYPE = "playlist.created";

    public PlaylistCreated {
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
        return createdAt;
    }
}
