package com.starscape.capture.features.pinterest.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.pinterest.domain.Pin;

import java.time.Instant;
import java.util.Objects;

public record PinDownloaded(
    String pinId,
    String localPath,
    Instant downloadedAt
) implements DomainEvent {

    public static final String TYPE = "pinterest.pin.downloaded";

    public PinDownloaded {
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
        return downloadedAt;
    }
}
