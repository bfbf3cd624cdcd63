package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record ThreadId(String value) implements Identifier {

    public ThreadId {
        Guard.requireNonBlank("threadId", value);
    }

    public static ThreadId of(String value) {
        return new ThreadId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
