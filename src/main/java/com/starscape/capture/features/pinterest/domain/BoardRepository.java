package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface BoardRepository extends AggregateRepository<Board, BoardId> {

    @Override
    default String aggregateType() {
        return Board.AGGREGATE_TYPE;
    }
}
