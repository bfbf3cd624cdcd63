package com.starscape.capture.common.outbox;

import com.starscape.capture.common.config.JacksonConfig;
import com.starscape.capture.common.exception.NotFoundException;
import com.starscape.capture.common.observability.MdcKeys;
import com.starscape.capture.features.pinterest.domain.Board;
import com.starscape.capture.features.pinterest.domain.BoardId;
import com.starscape.capture.features.pinterest.domain.PinId;
import com.starscape.capture.features.pinterest.domain.UserId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest {

    private InMemoryOutboxEventRepository repository;
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryOutboxEventRepository();
        outboxService = new OutboxService(repository, new JacksonConfig().objectMapper());
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void preparedEventsAreStoredOnlyWhenAsked() {
        List<OutboxEvent> prepared = outboxService.prepare(boardWithTwoEvents());

        assertEquals(2, prepared.size());
        assertTrue(outboxService.findPending(10).isEmpty());

        outboxService.store(prepared);

        assertEquals(List.of("pinterest.board.created", "pinterest.board.synced"),
                outboxService.findPending(10).stream().map(OutboxEvent::getEventType).toList());
    }

    @Test
    void eventsOfOneCommandShareTheRequestCorrelationId() {
        MDC.put(MdcKeys.CORRELATION_ID, "req-42");

        List<OutboxEvent> prepared = outboxService.prepare(boardWithTwoEvents());

        assertTrue(prepared.stream().allMatch(e -> "req-42".equals(e.getCorrelationId())));
    }

    @Test
    void acknowledgedEventLeavesPendingAndKeepsFirstTimestamp() {
        outboxService.store(outboxService.prepare(boardWithTwoEvents()));
        OutboxEvent first = outboxService.findPending(1).get(0);

        outboxService.acknowledge(first.getEventId());
        Instant processedAt = repository.findById(first.getEventId()).orElseThrow().getProcessedAt();
        outboxService.acknowledge(first.getEventId());

        assertNotNull(processedAt);
        assertEquals(processedAt, repository.findById(first.getEventId()).orElseThrow().getProcessedAt());
        assertEquals(1, outboxService.findPending(10).size());
        assertNotEquals(first.getEventId(), outboxService.findPending(10).get(0).getEventId());
    }

    @Test
    void acknowledgingUnknownEventIsNotFound() {
        assertThrows(NotFoundException.class, () -> outboxService.acknowledge("evt_missing"));
    }

    private static Board boardWithTwoEvents() {
        Board board = Board.create(BoardId.of("b-1"), "Kitchens", "", UserId.of("user-1"), false);
        board.syncPins(List.of(PinId.of("1"), PinId.of("2")));
        return board;
    }
}
