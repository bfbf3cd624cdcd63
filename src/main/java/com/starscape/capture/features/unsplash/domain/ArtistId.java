package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record ArtistId(String value) implements Identifier {

    public ArtistId {
        Guard.requireNonBlank("artistId", value);
    }

    public static ArtistId of(String value) {
        return new ArtistId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
