package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record UserProfile(
    String username,
    String displayName,
    String bio,
    String profilePictureUrl,
    String website,
    String location
) implements ValueObject {

    public UserProfile {
        Guard.requireNonBlank("username", username);
        displayName = displayName == null || displayName.isBlank() ? username : displayName;
    }
}
