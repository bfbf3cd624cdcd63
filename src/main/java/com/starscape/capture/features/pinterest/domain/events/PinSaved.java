package com.starscape.capture.features.pinterest.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.pinterest.domain.Pin;
import com.starscape.capture.features.pinterest.domain.PinMetadata;

import java.time.Instant;
import java.util.Objects;

public record PinSaved(
    String pinId,
    String boardId,
    PinMetadata metadata,
    Instant savedAt
) implements DomainEvent {

    public static final String TYPE = "pinterest.pin.saved";

    public PinSaved {
        Objects.requireNonNull(pinId, "pinId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Pin.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return pinId;
    }

    @Override
    public Instant getOccurredOn() {
        return savedAt;
    }
}
