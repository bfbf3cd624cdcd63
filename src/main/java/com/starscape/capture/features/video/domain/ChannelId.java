package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

import java.util.regex.Pattern;

/**
 * Channel ids are {@code UC} followed by 22 url-safe characters.
 */
public record ChannelId(String value) implements Identifier {

    private static final Pattern FORMAT = Pattern.compile("^UC[A-Za-z0-9_-]{22}$");

    public ChannelId {
        Guard.requireMatches("channelId", value, FORMAT, "UC followed by 22 characters of [A-Za-z0-9_-]");
    }

    public static ChannelId of(String value) {
        return new ChannelId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
