package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

import java.util.regex.Pattern;

/**
 * Pinterest pin ids are numeric strings.
 */
public record PinId(String value) implements Identifier {

    private static final Pattern FORMAT = Pattern.compile("^\\d+$");

    public PinId {
        Guard.requireMatches("pinId", value, FORMAT, "a numeric string");
    }

    public static PinId of(String value) {
        return new PinId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
