package com.starscape.capture.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.common.exception.NotFoundException;
import com.starscape.capture.common.observability.MdcKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class OutboxService {

    private static final Logger log = LoggerFactory.getLogger(OutboxService.class);

    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;

    public OutboxService(OutboxEventRepository outboxRepository, ObjectMapper objectMapper) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Drain the aggregate's buffer into outbox rows, in recording order, without storing them.
     * Serialization failures surface here, before the caller has saved anything.
     */
    public List<OutboxEvent> prepare(AggregateRoot<?> aggregate) {
        String correlationId = currentCorrelationId();
        return aggregate.pullDomainEvents().stream()
                .map(event -> toOutboxEvent(event, correlationId))
                .toList();
    }

    public void store(List<OutboxEvent> outboxEvents) {
        for (OutboxEvent outboxEvent : outboxEvents) {
            outboxRepository.save(outboxEvent);
            log.debug("Outbox event {} stored: type={}, aggregateId={}",
                    outboxEvent.getEventId(), outboxEvent.getEventType(), outboxEvent.getAggregateId());
        }
    }

    private OutboxEvent toOutboxEvent(DomainEvent event, String correlationId) {
        try {
            String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
            String payload = objectMapper.writeValueAsString(event);

            return new OutboxEvent(
                eventId,
                event.getAggregateType(),
                event.getAggregateId(),
                event.getEventType(),
                payload,
                correlationId,
                event.getOccurredOn()
            );
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize event " + event.getEventType(), e);
        }
    }

    public List<OutboxEvent> findPending(int limit) {
        return outboxRepository.findUnprocessedEventsWithLimit(limit);
    }

    public void acknowledge(String eventId) {
        outboxRepository.markProcessed(eventId)
                .orElseThrow(() -> new NotFoundException("Outbox event not found: " + eventId));
    }

    private String currentCorrelationId() {
        String correlationId = MDC.get(MdcKeys.CORRELATION_ID);
        return correlationId != null ? correlationId : UUID.randomUUID().toString();
    }
}
