package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record ArtistStats(
    long totalPhotos,
    long totalLikes,
    long totalViews,
    long totalDownloads,
    long followersCount,
    long followingCount
) implements ValueObject {

    public ArtistStats {
        Guard.requireNonNegative("totalPhotos", totalPhotos);
        Guard.requireNonNegative("totalLikes", totalLikes);
        Guard.requireNonNegative("totalViews", totalViews);
        Guard.requireNonNegative("totalDownloads", totalDownloads);
        Guard.requireNonNegative("followersCount", followersCount);
        Guard.requireNonNegative("followingCount", followingCount);
    }
}
