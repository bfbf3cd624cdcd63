package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.pinterest.domain.events.BoardSynced;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardTest {

    private Board board;

    @BeforeEach
    void setUp() {
        board = Board.create(BoardId.of("board-1"), "Recipes", null, UserId.of("owner-1"), false);
        board.pullDomainEvents();
    }

    @Test
    void incrementalChangesRecordNoEvents() {
        board.addPin(PinId.of("1"));
        board.addPin(PinId.of("2"));
        board.addPin(PinId.of("1"));
        board.removePin(PinId.of("2"));

        assertEquals(List.of(PinId.of("1")), board.getPinIds());
        assertTrue(board.pullDomainEvents().isEmpty());
    }

    @Test
    void removingUnknownPinFails() {
        assertThrows(InvalidStateException.class, () -> board.removePin(PinId.of("9")));
    }

    @Test
    void syncWithEmptyListClearsBoardAndRecordsOneEvent() {
        for (int i = 1; i <= 5; i++) {
            board.addPin(PinId.of(String.valueOf(i)));
        }

        board.syncPins(List.of());

        assertEquals(0, board.getPinCount());
        List<DomainEvent> events = board.pullDomainEvents();
        assertEquals(1, events.size());
        BoardSynced synced = assertInstanceOf(BoardSynced.class, events.get(0));
        assertTrue(synced.pinIds().isEmpty());
        assertTrue(board.getLastSyncedAt().isPresent());
    }

    @Test
    void syncReplacesMembershipWholesale() {
        board.addPin(PinId.of("1"));
        board.addPin(PinId.of("2"));

        board.syncPins(List.of(PinId.of("3"), PinId.of("1")));

        assertEquals(List.of(PinId.of("3"), PinId.of("1")), board.getPinIds());
        BoardSynced synced = (BoardSynced) board.pullDomainEvents().get(0);
        assertEquals(List.of("3", "1"), synced.pinIds());
    }
}
