package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Reel;

import java.time.Instant;
import java.util.Objects;

public record ReelDownloaded(
    String reelId,
    String authorId,
    String localPath,
    Instant downloadedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.reel.downloaded";

    public ReelDownloaded {
        Objects.requireNonNull(reelId, "reelId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Reel.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return reelId;
    }

    @Override
    public Instant getOccurredOn() {
        return downloadedAt;
    }
}
