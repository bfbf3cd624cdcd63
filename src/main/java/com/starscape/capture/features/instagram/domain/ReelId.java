package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record ReelId(String value) implements Identifier {

    public ReelId {
        Guard.requireNonBlank("reelId", value);
    }

    public static ReelId of(String value) {
        return new ReelId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
