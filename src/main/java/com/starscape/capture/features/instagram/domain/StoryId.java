package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record StoryId(String value) implements Identifier {

    public StoryId {
        Guard.requireNonBlank("storyId", value);
    }

    public static StoryId of(String value) {
        return new StoryId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
