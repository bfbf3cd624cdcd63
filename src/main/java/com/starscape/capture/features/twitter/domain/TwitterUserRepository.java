package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface TwitterUserRepository extends AggregateRepository<TwitterUser, UserId> {

    @Override
    default String aggregateType() {
        return TwitterUser.AGGREGATE_TYPE;
    }
}
