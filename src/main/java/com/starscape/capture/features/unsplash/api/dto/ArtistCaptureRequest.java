package com.starscape.capture.features.unsplash.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record ArtistCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "username is required")
    String username,
    String firstName,
    String lastName,
    String bio,
    String location,
    String portfolioUrl,
    String instagramUsername,
    String twitterUsername,
    String profileImageUrl,
    @PositiveOrZero Long totalPhotos,
    @PositiveOrZero Long totalLikes,
    @PositiveOrZero Long totalViews,
    @PositiveOrZero Long totalDownloads,
    @PositiveOrZero Long followersCount,
    @PositiveOrZero Long followingCount,
    @JsonProperty("isForHire") Boolean forHire,
    Boolean acceptsDonations
) {}
