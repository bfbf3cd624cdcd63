package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record PostId(String value) implements Identifier {

    public PostId {
        Guard.requireNonBlank("postId", value);
    }

    public static PostId of(String value) {
        return new PostId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
