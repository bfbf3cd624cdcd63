package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface InstagramUserRepository extends AggregateRepository<InstagramUser, UserId> {

    @Override
    default String aggregateType() {
        return InstagramUser.AGGREGATE_TYPE;
    }
}
