package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.ValidationException;

public enum LicenseType {
    FREE,
    PLUS,
    PREMIUM;

    public static LicenseType fromValue(String value) {
        if (value != null) {
            for (LicenseType type : values()) {
                if (type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new ValidationException("type", "type must be one of free, plus, premium: " + value);
    }
}
