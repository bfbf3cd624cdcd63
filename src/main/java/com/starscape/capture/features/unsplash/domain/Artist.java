package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.unsplash.domain.events.ArtistFollowed;
import com.starscape.capture.features.unsplash.domain.events.ArtistProfileUpdated;

import java.time.Instant;
import java.util.Optional;

public class Artist extends AggregateRoot<ArtistId> {

    public static final String AGGREGATE_TYPE = "unsplash.artist";

    private final ArtistId id;
    private ArtistProfile profile;
    private ArtistStats stats;
    private boolean forHire;
    private boolean acceptsDonations;
    private Instant followedAt;

    private Artist(ArtistId id, ArtistProfile profile, ArtistStats stats, boolean forHire, boolean acceptsDonations) {
        this.id = Guard.requireNonNull("artistId", id);
        this.profile = Guard.requireNonNull("profile", profile);
        this.stats = Guard.requireNonNull("stats", stats);
        this.forHire = forHire;
        this.acceptsDonations = acceptsDonations;
    }

    public static Artist create(ArtistId id, ArtistProfile profile, ArtistStats stats, boolean forHire,
                                boolean acceptsDonations) {
        return new Artist(id, profile, stats, forHire, acceptsDonations);
    }

    public static Artist fromSnapshot(Snapshot snapshot) {
        Artist artist = new Artist(ArtistId.of(snapshot.id()), snapshot.profile(), snapshot.stats(),
                snapshot.forHire(), snapshot.acceptsDonations());
        artist.followedAt = snapshot.followedAt();
        return artist;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), profile, stats, forHire, acceptsDonations, followedAt);
    }

    public void follow() {
        if (isFollowed()) {
            throw new AlreadyExistsException("ALREADY_FOLLOWED", "Artist " + profile.username() + " is already followed");
        }
        this.followedAt = Instant.now();
        record(new ArtistFollowed(id.value(), profile.username(), followedAt));
    }

    public void unfollow() {
        this.followedAt = null;
    }

    public void updateProfile(ArtistProfile newProfile) {
        Guard.requireNonNull("profile", newProfile);
        ArtistProfile oldProfile = this.profile;
        this.profile = newProfile;
        record(new ArtistProfileUpdated(id.value(), oldProfile, newProfile, Instant.now()));
    }

    public void updateStats(ArtistStats stats) {
        this.stats = Guard.requireNonNull("stats", stats);
    }

    public void setForHire(boolean forHire) {
        this.forHire = forHire;
    }

    public void setAcceptsDonations(boolean acceptsDonations) {
        this.acceptsDonations = acceptsDonations;
    }

    public boolean isFollowed() {
        return followedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public ArtistId getId() {
        return id;
    }

    // Getters
    public ArtistProfile getProfile() { return profile; }
    public ArtistStats getStats() { return stats; }
    public boolean isForHire() { return forHire; }
    public boolean isAcceptsDonations() { return acceptsDonations; }
    public Optional<Instant> getFollowedAt() { return Optional.ofNullable(followedAt); }

    public record Snapshot(
        String id,
        ArtistProfile profile,
        ArtistStats stats,
        boolean forHire,
        boolean acceptsDonations,
        Instant followedAt
    ) {
    }
}
