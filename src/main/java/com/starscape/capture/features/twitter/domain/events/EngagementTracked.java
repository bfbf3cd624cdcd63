package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Engagement;
import com.starscape.capture.features.twitter.domain.EngagementMetrics;
import com.starscape.capture.features.twitter.domain.EngagementPeriod;

import java.time.Instant;
import java.util.Objects;

public record EngagementTracked(
    String tweetId,
    String authorId,
    EngagementMetrics metrics,
    EngagementPeriod period,
    Instant trackedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.engagement.tracked";

    public EngagementTracked {
        Objects.requireNonNull(tweetId, "tweetId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Engagement.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return tweetId;
    }

    @Override
    public Instant getOccurredOn() {
        return trackedAt;
    }
}
