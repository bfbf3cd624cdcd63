package com.starscape.capture.features.pinterest.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.pinterest.domain.Board;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Full membership snapshot of a board after a sync. An empty list means the board was cleared.
 */
public record BoardSynced(
    String boardId,
    List<String> pinIds,
    Instant syncedAt
) implements DomainEvent {

    public static final String TYPE = "pinterest.board.synced";

    public BoardSynced {
        Objects.requireNonNull(boardId, "boardId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Board.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return boardId;
    }

    @Override
    public Instant getOccurredOn() {
        return syncedAt;
    }
}
