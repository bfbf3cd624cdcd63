package com.starscape.capture.features.unsplash.app;

import com.starscape.capture.features.unsplash.api.dto.ArtistCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistProfileRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistStatsRequest;
import com.starscape.capture.features.unsplash.api.dto.LicenseIssueRequest;
import com.starscape.capture.features.unsplash.api.dto.PhotoCaptureRequest;
import com.starscape.capture.features.unsplash.domain.ArtistProfile;
import com.starscape.capture.features.unsplash.domain.ArtistStats;
import com.starscape.capture.features.unsplash.domain.LicenseTerms;
import com.starscape.capture.features.unsplash.domain.LicenseType;
import com.starscape.capture.features.unsplash.domain.PhotoAttributes;
import com.starscape.capture.features.unsplash.domain.RevenueModel;

import java.time.Instant;

import static java.util.Objects.requireNonNullElse;

final class UnsplashPayloads {

    private UnsplashPayloads() {
    }

    static PhotoAttributes photoAttributes(PhotoCaptureRequest request) {
        return new PhotoAttributes(
            request.title(),
            request.description(),
            request.url(),
            request.downloadUrl(),
            request.thumbnailUrl(),
            request.width(),
            request.height(),
            request.color(),
            requireNonNullElse(request.likes(), 0L),
            requireNonNullElse(request.downloads(), 0L),
            request.tags(),
            requireNonNullElse(request.createdAt(), Instant.now())
        );
    }

    /**
     * A license without revenue shares pays the author everything.
     */
    static LicenseTerms licenseTerms(LicenseIssueRequest request) {
        RevenueModel revenueModel = request.authorShare() != null
                ? new RevenueModel(
                    request.authorShare(),
                    requireNonNullElse(request.platformShare(), 0),
                    requireNonNullElse(request.affiliateShare(), 0),
                    requireNonNullElse(request.charityShare(), 0))
                : RevenueModel.authorOnly();
        return new LicenseTerms(
            LicenseType.fromValue(requireNonNullElse(request.type(), "free")),
            request.name(),
            request.description(),
            Boolean.TRUE.equals(request.allowsCommercialUse()),
            requireNonNullElse(request.requiresAttribution(), true),
            Boolean.TRUE.equals(request.allowsModification()),
            Boolean.TRUE.equals(request.allowsDistribution()),
            request.restrictions(),
            request.expiresAt(),
            request.downloadLimit(),
            request.maxResolution(),
            revenueModel
        );
    }

    static ArtistProfile artistProfile(ArtistCaptureRequest request) {
        return new ArtistProfile(request.username(), request.firstName(), request.lastName(), request.bio(),
                request.location(), request.portfolioUrl(), request.instagramUsername(), request.twitterUsername(),
                request.profileImageUrl());
    }

    static ArtistProfile artistProfile(ArtistProfileRequest request) {
        return new ArtistProfile(request.username(), request.firstName(), request.lastName(), request.bio(),
                request.location(), request.portfolioUrl(), request.instagramUsername(), request.twitterUsername(),
                request.profileImageUrl());
    }

    static ArtistStats artistStats(ArtistCaptureRequest request) {
        return new ArtistStats(
            requireNonNullElse(request.totalPhotos(), 0L),
            requireNonNullElse(request.totalLikes(), 0L),
            requireNonNullElse(request.totalViews(), 0L),
            requireNonNullElse(request.totalDownloads(), 0L),
            requireNonNullElse(request.followersCount(), 0L),
            requireNonNullElse(request.followingCount(), 0L)
        );
    }

    static ArtistStats artistStats(ArtistStatsRequest request) {
        return new ArtistStats(request.totalPhotos(), request.totalLikes(), request.totalViews(),
                request.totalDownloads(), request.followersCount(), request.followingCount());
    }
}
