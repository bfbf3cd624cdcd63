package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.MediaType;
import com.starscape.capture.features.instagram.domain.Story;

import java.time.Instant;
import java.util.Objects;

public record StoryCaptured(
    String storyId,
    String authorId,
    String mediaUrl,
    MediaType mediaType,
    Instant expiresAt,
    Instant capturedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.story.captured";

    public StoryCaptured {
        Objects.requireNonNull(storyId, "storyId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Story.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return storyId;
    }

    @Override
    public Instant getOccurredOn() {
        return capturedAt;
    }
}
