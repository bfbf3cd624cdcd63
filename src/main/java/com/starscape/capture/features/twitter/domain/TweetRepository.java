package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface TweetRepository extends AggregateRepository<Tweet, TweetId> {

    @Override
    default String aggregateType() {
        return Tweet.AGGREGATE_TYPE;
    }
}
