package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.InstagramUser;
import com.starscape.capture.features.instagram.domain.UserProfile;

import java.time.Instant;
import java.util.Objects;

public record UserProfileUpdated(
    String userId,
    UserProfile oldProfile,
    UserProfile newProfile,
    Instant updatedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.user.profile.updated";

    public UserProfileUpdated {
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
        return updatedAt;
    }
}
