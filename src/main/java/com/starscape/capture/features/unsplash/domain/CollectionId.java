package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record CollectionId(String value) implements Identifier {

    public CollectionId {
        Guard.requireNonBlank("collectionId", value);
    }

    public static CollectionId of(String value) {
        return new CollectionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
