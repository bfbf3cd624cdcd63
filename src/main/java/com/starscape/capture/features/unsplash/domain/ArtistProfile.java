package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record ArtistProfile(
    String username,
    String firstName,
    String lastName,
    String bio,
    String location,
    String portfolioUrl,
    String instagramUsername,
    String twitterUsername,
    String profileImageUrl
) implements ValueObject {

    public ArtistProfile {
        Guard.requireNonBlank("username", username);
        firstName = firstName == null ? "" : firstName;
        lastName = lastName == null ? "" : lastName;
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
