package com.starscape.capture.common.outbox;

import java.util.List;
import java.util.Optional;

public interface OutboxEventRepository {
    OutboxEvent save(OutboxEvent event);
    Optional<OutboxEvent> findById(String eventId);
    List<OutboxEvent> findUnprocessedEventsWithLimit(int limit);
    List<OutboxEvent> findByAggregateId(String aggregateId);

    /**
     * Mark the event processed; repeating the call keeps the first timestamp.
     */
    Optional<OutboxEvent> markProcessed(String eventId);
}
