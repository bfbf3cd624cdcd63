package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;

public record TwitterProfile(
    String username,
    String displayName,
    String bio,
    String location,
    String website,
    String profileImageUrl,
    String bannerImageUrl,
    Instant joinedAt
) implements ValueObject {

    public TwitterProfile {
        Guard.requireNonBlank("username", username);
        displayName = displayName == null || displayName.isBlank() ? username : displayName;
    }
}
