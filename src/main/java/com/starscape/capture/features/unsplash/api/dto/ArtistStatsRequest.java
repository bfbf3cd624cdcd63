package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ArtistStatsRequest(
    @NotNull(message = "totalPhotos is required") @PositiveOrZero Long totalPhotos,
    @NotNull(message = "totalLikes is required") @PositiveOrZero Long totalLikes,
    @NotNull(message = "totalViews is required") @PositiveOrZero Long totalViews,
    @NotNull(message = "totalDownloads is required") @PositiveOrZero Long totalDownloads,
    @NotNull(message = "followersCount is required") @PositiveOrZero Long followersCount,
    @NotNull(message = "followingCount is required") @PositiveOrZero Long followingCount
) {}
