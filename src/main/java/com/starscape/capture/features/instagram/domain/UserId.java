package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

/**
 * Instagram account id, used both for captured profiles and as the author of posts, reels and stories.
 */
public record UserId(String value) implements Identifier {

    public UserId {
        Guard.requireNonBlank("userId", value);
    }

    public static UserId of(String value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
