package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Reel;

import java.time.Instant;
import java.util.Objects;

public record ReelDownloadRequested(
    String reelId,
    String authorId,
    String videoUrl,
    Instant requestedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.reel.download.requested";

    public ReelDownloadRequested {
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
        return requestedAt;
    }
}
