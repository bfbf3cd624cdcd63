package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

/**
 * Twitter account id, used for captured profiles and as tweet and thread author.
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
