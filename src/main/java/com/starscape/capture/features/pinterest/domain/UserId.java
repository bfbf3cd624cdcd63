package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

/**
 * Pinterest account that owns a board.
 */
public record UserId(String value) implements Identifier {

    public UserId {
        Guard.requireNonBlank("ownerId", value);
    }

    public static UserId of(String value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
