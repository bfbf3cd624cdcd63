package com.starscape.capture.common.outbox;

import java.time.Instant;

/**
 * Envelope handed to the download/transport consumer for one drained domain event.
 */
public class OutboxEvent {

    private final String eventId;
    private final String aggregateType;
    private final String aggregateId;
    private final String eventType;
    private final String payload;
    private final String correlationId;
    private final Instant occurredOn;
    private final Instant createdAt;
    private volatile Instant processedAt;

    public OutboxEvent(String eventId, String aggregateType, String aggregateId,
                       String eventType, String payload, String correlationId, Instant occurredOn) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("Aggregate ID is required");
        }
        this.eventId = eventId;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.correlationId = correlationId;
        this.occurredOn = occurredOn;
        this.createdAt = Instant.now();
    }

    // Getters
    public String getEventId() { return eventId; }
    public String getAggregateType() { return aggregateType; }
    public String getAggregateId() { return aggregateId; }
    public String getEventType() { return eventType; }
    public String getPayload() { return payload; }
    public String getCorrelationId() { return correlationId; }
    public Instant getOccurredOn() { return occurredOn; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getProcessedAt() { return processedAt; }

    void markProcessed() {
        if (processedAt == null) {
            this.processedAt = Instant.now();
        }
    }

    public boolean isProcessed() {
        return processedAt != null;
    }
}
