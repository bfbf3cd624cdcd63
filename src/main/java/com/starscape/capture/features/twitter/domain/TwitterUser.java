package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.twitter.domain.events.UserFollowed;
import com.starscape.capture.features.twitter.domain.events.UserProfileUpdated;

import java.time.Instant;
import java.util.Optional;

public class TwitterUser extends AggregateRoot<UserId> {

    public static final String AGGREGATE_TYPE = "twitter.user";

    private final UserId id;
    private TwitterProfile profile;
    private TwitterStats stats;
    private boolean verified;
    private boolean protectedAccount;
    private Instant followedAt;

    private TwitterUser(UserId id, TwitterProfile profile, TwitterStats stats, boolean verified,
                        boolean protectedAccount) {
        this.id = Guard.requireNonNull("userId", id);
        this.profile = Guard.requireNonNull("profile", profile);
        this.stats = Guard.requireNonNull("stats", stats);
        this.verified = verified;
        this.protectedAccount = protectedAccount;
    }

    public static TwitterUser create(UserId id, TwitterProfile profile, TwitterStats stats, boolean verified,
                                     boolean protectedAccount) {
        return new TwitterUser(id, profile, stats, verified, protectedAccount);
    }

    public static TwitterUser fromSnapshot(Snapshot snapshot) {
        TwitterUser user = new TwitterUser(UserId.of(snapshot.id()), snapshot.profile(), snapshot.stats(),
                snapshot.verified(), snapshot.protectedAccount());
        user.followedAt = snapshot.followedAt();
        return user;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), profile, stats, verified, protectedAccount, followedAt);
    }

    public void follow() {
        if (isFollowed()) {
            throw new AlreadyExistsException("ALREADY_FOLLOWED", "User @" + profile.username() + " is already followed");
        }
        this.followedAt = Instant.now();
        record(new UserFollowed(id.value(), profile.username(), followedAt));
    }

    public void unfollow() {
        this.followedAt = null;
    }

    public void updateProfile(TwitterProfile newProfile) {
        Guard.requireNonNull("profile", newProfile);
        TwitterProfile oldProfile = this.profile;
        this.profile = newProfile;
        record(new UserProfileUpdated(id.value(), oldProfile, newProfile, Instant.now()));
    }

    public void updateStats(TwitterStats stats) {
        this.stats = Guard.requireNonNull("stats", stats);
    }

    public void verify() {
        this.verified = true;
    }

    public void protect() {
        this.protectedAccount = true;
    }

    public void unprotect() {
        this.protectedAccount = false;
    }

    public boolean isFollowed() {
        return followedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UserId getId() {
        return id;
    }

    // Getters
    public TwitterProfile getProfile() { return profile; }
    public TwitterStats getStats() { return stats; }
    public boolean isVerified() { return verified; }
    public boolean isProtectedAccount() { return protectedAccount; }
    public Optional<Instant> getFollowedAt() { return Optional.ofNullable(followedAt); }

    public record Snapshot(
        String id,
        TwitterProfile profile,
        TwitterStats stats,
        boolean verified,
        boolean protectedAccount,
        Instant followedAt
    ) {
    }
}
