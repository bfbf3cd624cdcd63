package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record PhotoId(String value) implements Identifier {

    public PhotoId {
        Guard.requireNonBlank("photoId", value);
    }

    public static PhotoId of(String value) {
        return new PhotoId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
