package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.License;

import java.time.Instant;
import java.util.Objects;

public record LicenseUsed(
    String licenseId,
    int usageCount,
    Integer downloadLimit,
    Instant usedAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.license.used";

    public LicenseUsed {
        Objects.requireNonNull(licenseId, "licenseId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return License.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return licenseId;
    }

    @Override
    public Instant getOccurredOn() {
        return usedAt;
    }
}
