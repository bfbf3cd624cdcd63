package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.Engagement;
import com.starscape.capture.features.twitter.domain.EngagementMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record EngagementAnalyzed(
    String tweetId,
    String authorId,
    EngagementMetrics metrics,
    List<String> insights,
    Instant analyzedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.engagement.analyzed";

    public EngagementAnalyzed {
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
        return analyzedAt;
    }
}
