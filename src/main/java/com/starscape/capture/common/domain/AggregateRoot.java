package com.starscape.capture.common.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Consistency boundary that buffers the domain events produced by its own mutations.
 * Subclasses only change state inside their public command methods, and each accepted
 * command records its event through {@link #record(DomainEvent)} after the state change.
 */
public abstract class AggregateRoot<ID extends Identifier> extends Entity<ID> {

    private final transient List<DomainEvent> domainEvents = new ArrayList<>();

    protected AggregateRoot() {
        super();
    }

    /**
     * Dotted aggregate type used for routing, e.g. {@code instagram.post}.
     */
    public abstract String getAggregateType();

    protected void record(DomainEvent event) {
        if (event.getAggregateId() == null || !event.getAggregateId().equals(getId().value())) {
            throw new IllegalStateException("Event " + event.getEventType()
                    + " does not belong to aggregate " + getId().value());
        }
        domainEvents.add(event);
    }

    /**
     * Pending events without draining them.
     */
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    /**
     * Drain the buffer. Each event is handed out exactly once.
     */
    public List<DomainEvent> pullDomainEvents() {
        List<DomainEvent> pulled = List.copyOf(domainEvents);
        domainEvents.clear();
        return pulled;
    }
}
