package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;
import com.starscape.capture.common.exception.ValidationException;

/**
 * A license attaches to one (photo, artist) pair. Its string form is {@code photoId/artistId}.
 */
public record LicenseId(PhotoId photoId, ArtistId artistId) implements Identifier {

    private static final String SEPARATOR = "/";

    public LicenseId {
        Guard.requireNonNull("photoId", photoId);
        Guard.requireNonNull("artistId", artistId);
    }

    public static LicenseId of(PhotoId photoId, ArtistId artistId) {
        return new LicenseId(photoId, artistId);
    }

    public static LicenseId parse(String value) {
        Guard.requireNonBlank("licenseId", value);
        int separator = value.indexOf(SEPARATOR);
        if (separator <= 0 || separator == value.length() - 1 || value.indexOf(SEPARATOR, separator + 1) >= 0) {
            throw new ValidationException("licenseId", "licenseId must be photoId/artistId: " + value);
        }
        return new LicenseId(PhotoId.of(value.substring(0, separator)), ArtistId.of(value.substring(separator + 1)));
    }

    @Override
    public String value() {
        return photoId.value() + SEPARATOR + artistId.value();
    }

    @Override
    public String toString() {
        return value();
    }
}
