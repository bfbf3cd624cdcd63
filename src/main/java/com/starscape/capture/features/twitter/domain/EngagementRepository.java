package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface EngagementRepository extends AggregateRepository<Engagement, TweetId> {

    @Override
    default String aggregateType() {
        return Engagement.AGGREGATE_TYPE;
    }
}
