package com.starscape.capture.features.pinterest.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.pinterest.domain.Board;

import java.time.Instant;
import java.util.Objects;

public record BoardCreated(
    String boardId,
    String name,
    String description,
    String ownerId,
    Instant createdAt
) implements DomainEvent {

    public static final String TYPE = "pinterest.board.created";

    public BoardCreated {
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
        return createdAt;
    }
}
