package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.exception.ValidationException;

public enum VideoQuality {
    LOW("144p"),
    MEDIUM("360p"),
    HIGH("720p"),
    FULL_HD("1080p"),
    FOUR_K("2160p");

    private final String label;

    VideoQuality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHighDefinition() {
        return this == HIGH || this == FULL_HD || this == FOUR_K;
    }

    /**
     * Accepts either the resolution label ({@code 720p}) or the constant name ({@code HIGH}).
     */
    public static VideoQuality fromValue(String value) {
        if (value != null) {
            for (VideoQuality quality : values()) {
                if (quality.label.equalsIgnoreCase(value) || quality.name().equalsIgnoreCase(value)) {
                    return quality;
                }
            }
        }
        throw new ValidationException("quality", "Unknown video quality: " + value);
    }
}
