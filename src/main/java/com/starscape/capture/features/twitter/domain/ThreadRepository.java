package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface ThreadRepository extends AggregateRepository<Thread, ThreadId> {

    @Override
    default String aggregateType() {
        return Thread.AGGREGATE_TYPE;
    }
}
