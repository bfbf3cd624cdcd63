package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Reel;
import com.starscape.capture.features.instagram.domain.ReelAttributes;

import java.time.Instant;
import java.util.Objects;

public record ReelSaved(
    String reelId,
    String authorId,
    ReelAttributes attributes,
    Instant savedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.reel.saved";

    public ReelSaved {
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
        return savedAt;
    }
}
