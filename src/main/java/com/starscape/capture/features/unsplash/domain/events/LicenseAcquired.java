package com.starscape.capture.features.unsplash.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.unsplash.domain.License;
import com.starscape.capture.features.unsplash.domain.LicenseType;

import java.time.Instant;
import java.util.Objects;

public record LicenseAcquired(
    String licenseId,
    String photoId,
    String artistId,
    LicenseType type,
    Instant acquiredAt
) implements DomainEvent {

    public static final String TYPE = "unsplash.license.acquired";

    public LicenseAcquired {
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
        return acquiredAt;
    }
}
