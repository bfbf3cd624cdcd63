package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

import java.util.regex.Pattern;

public record PlaylistId(String value) implements Identifier {

    private static final Pattern FORMAT = Pattern.compile("^PL[A-Za-z0-9_-]{32}$");

    public PlaylistId {
        Guard.requireMatches("playlistId", value, FORMAT, "PL followed by 32 characters of [A-Za-z0-9_-]");
    }

    public static PlaylistId of(String value) {
        return new PlaylistId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
