package com.starscape.capture.common.outbox;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered outbox. Unprocessed events come back oldest first.
 */
@Repository
public class InMemoryOutboxEventRepository implements OutboxEventRepository {

    private final Map<String, OutboxEvent> events = new LinkedHashMap<>();

    @Override
    public synchronized OutboxEvent save(OutboxEvent event) {
        events.put(event.getEventId(), event);
        return event;
    }

    @Override
    public synchronized Optional<OutboxEvent> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public synchronized List<OutboxEvent> findUnprocessedEventsWithLimit(int limit) {
        List<OutboxEvent> result = new ArrayList<>();
        for (OutboxEvent event : events.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (!event.isProcessed()) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized List<OutboxEvent> findByAggregateId(String aggregateId) {
        return events.values().stream()
                .filter(e -> e.getAggregateId().equals(aggregateId))
                .toList();
    }

    @Override
    public synchronized Optional<OutboxEvent> markProcessed(String eventId) {
        OutboxEvent event = events.get(eventId);
        if (event != null) {
            event.markProcessed();
        }
        return Optional.ofNullable(event);
    }
}
