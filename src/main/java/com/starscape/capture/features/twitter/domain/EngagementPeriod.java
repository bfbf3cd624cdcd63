package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.exception.ValidationException;

public enum EngagementPeriod {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    public static EngagementPeriod fromValue(String value) {
        if (value != null) {
            for (EngagementPeriod period : values()) {
                if (period.name().equalsIgnoreCase(value)) {
                    return period;
                }
            }
        }
        throw new ValidationException("period", "period must be one of hour, day, week, month: " + value);
    }
}
