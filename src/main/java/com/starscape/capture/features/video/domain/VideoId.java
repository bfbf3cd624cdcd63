package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

import java.util.regex.Pattern;

public record VideoId(String value) implements Identifier {

    private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9_-]{11}$");

    public VideoId {
        Guard.requireMatches("videoId", value, FORMAT, "11 characters of [A-Za-z0-9_-]");
    }

    public static VideoId of(String value) {
        return new VideoId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
