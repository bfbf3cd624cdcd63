package com.starscape.capture.common.domain;

import java.time.Instant;

/**
 * Immutable record of a business-significant transition of one aggregate.
 * The implementing record itself is the payload.
 */
public interface DomainEvent {
    String getEventType();
    String getAggregateType();
    String getAggregateId();
    Instant getOccurredOn();
}
