package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface CollectionRepository extends AggregateRepository<Collection, CollectionId> {

    @Override
    default String aggregateType() {
        return Collection.AGGREGATE_TYPE;
    }
}
