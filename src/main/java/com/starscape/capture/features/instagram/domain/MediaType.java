package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.exception.ValidationException;

public enum MediaType {
    IMAGE,
    VIDEO;

    public static MediaType fromValue(String value) {
        if (value != null) {
            for (MediaType type : values()) {
                if (type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new ValidationException("mediaType", "mediaType must be one of image, video: " + value);
    }
}
