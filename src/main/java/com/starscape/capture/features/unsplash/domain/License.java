package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.Expiry;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.ExpiredContentException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.unsplash.domain.events.LicenseAcquired;
import com.starscape.capture.features.unsplash.domain.events.LicenseUsed;

import java.time.Instant;
import java.util.Optional;

/**
 * Usage rights on one photo of one artist. A license is issued silently, acquired once,
 * then used one download at a time until it expires or reaches its download limit.
 */
public class License extends AggregateRoot<LicenseId> {

    public static final String AGGREGATE_TYPE = "unsplash.license";

    private final LicenseId id;
    private final LicenseTerms terms;
    private Instant acquiredAt;
    private int usageCount;

    private License(LicenseId id, LicenseTerms terms) {
        this.id = Guard.requireNonNull("licenseId", id);
        this.terms = Guard.requireNonNull("terms", terms);
    }

    public static License issue(PhotoId photoId, ArtistId artistId, LicenseTerms terms) {
        return new License(LicenseId.of(photoId, artistId), terms);
    }

    public static License fromSnapshot(Snapshot snapshot) {
        License license = new License(
                LicenseId.of(PhotoId.of(snapshot.photoId()), ArtistId.of(snapshot.artistId())), snapshot.terms());
        license.acquiredAt = snapshot.acquiredAt();
        license.usageCount = snapshot.usageCount();
        return license;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.photoId().value(), id.artistId().value(), terms, acquiredAt, usageCount);
    }

    public void acquire() {
        if (isAcquired()) {
            throw new AlreadyExistsException("ALREADY_ACQUIRED", "License " + id.value() + " is already acquired");
        }
        this.acquiredAt = Instant.now();
        record(new LicenseAcquired(id.value(), id.photoId().value(), id.artistId().value(), terms.type(), acquiredAt));
    }

    public void use() {
        if (!isAcquired()) {
            throw new InvalidStateException("LICENSE_NOT_ACQUIRED",
                    "License " + id.value() + " must be acquired before use");
        }
        if (isExpired()) {
            throw new ExpiredContentException("License " + id.value() + " has expired");
        }
        if (hasReachedDownloadLimit()) {
            throw new InvalidStateException("USAGE_LIMIT_REACHED",
                    "License " + id.value() + " reached its download limit of " + terms.downloadLimit());
        }
        this.usageCount += 1;
        record(new LicenseUsed(id.value(), usageCount, terms.downloadLimit(), Instant.now()));
    }

    public boolean isAcquired() {
        return acquiredAt != null;
    }

    public boolean isExpired() {
        return Expiry.at(terms.expiresAt()).isExpired();
    }

    public boolean hasReachedDownloadLimit() {
        return terms.downloadLimit() != null && usageCount >= terms.downloadLimit();
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public LicenseId getId() {
        return id;
    }

    // Getters
    public PhotoId getPhotoId() { return id.photoId(); }
    public ArtistId getArtistId() { return id.artistId(); }
    public LicenseTerms getTerms() { return terms; }
    public RevenueModel getRevenueModel() { return terms.revenueModel(); }
    public Optional<Instant> getAcquiredAt() { return Optional.ofNullable(acquiredAt); }
    public int getUsageCount() { return usageCount; }

    public record Snapshot(
        String photoId,
        String artistId,
        LicenseTerms terms,
        Instant acquiredAt,
        int usageCount
    ) {
    }
}
