package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.InstagramUser;

import java.time.Instant;
import java.util.Objects;

public record UserFollowed(
    String userId,
    String username,
    Instant followedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.user.followed";

    public UserFollowed {
        Objects.requireNonNull(userId, "userId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return InstagramUser.AGGREGATE_TYPE;
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
