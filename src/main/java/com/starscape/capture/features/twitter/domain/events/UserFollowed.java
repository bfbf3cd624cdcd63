package com.starscape.capture.features.twitter.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.twitter.domain.TwitterUser;

import java.time.Instant;
import java.util.Objects;

public record UserFollowed(
    String userId,
    String username,
    Instant followedAt
) implements DomainEvent {

    public static final String TYPE = "twitter.user.followed";

    public UserFollowed {
        Objects.requireNonNull(userId, "userId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return TwitterUser.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return userId;
    }

    @Override
    public Instant getOccurredOn() {
        return followedAt;
    }
}
