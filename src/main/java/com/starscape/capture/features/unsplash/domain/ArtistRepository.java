package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface ArtistRepository extends AggregateRepository<Artist, ArtistId> {

    @Override
    default String aggregateType() {
        return Artist.AGGREGATE_TYPE;
    }
}
