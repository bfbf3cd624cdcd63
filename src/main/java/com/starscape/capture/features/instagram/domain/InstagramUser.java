package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.instagram.domain.events.UserFollowed;
import com.starscape.capture.features.instagram.domain.events.UserProfileUpdated;

import java.time.Instant;
import java.util.Optional;

/**
 * Captured Instagram account. Following is the only business transition besides profile edits;
 * stat refreshes, verification and visibility toggles record nothing.
 */
public class InstagramUser extends AggregateRoot<UserId> {

    public static final String AGGREGATE_TYPE = "instagram.user";

    private final UserId id;
    private UserProfile profile;
    private UserStats stats;
    private boolean verified;
    private boolean privateAccount;
    private Instant followedAt;

    private InstagramUser(UserId id, UserProfile profile, UserStats stats) {
        this.id = Guard.requireNonNull("userId", id);
        this.profile = Guard.requireNonNull("profile", profile);
        this.stats = Guard.requireNonNull("stats", stats);
    }

    public static InstagramUser create(UserId id, UserProfile profile, UserStats stats,
                                       boolean verified, boolean privateAccount) {
        InstagramUser user = new InstagramUser(id, profile, stats);
        user.verified = verified;
        user.privateAccount = privateAccount;
        return user;
    }

    public static InstagramUser fromSnapshot(Snapshot snapshot) {
        InstagramUser user = create(UserId.of(snapshot.id()), snapshot.profile(), snapshot.stats(),
                snapshot.verified(), snapshot.privateAccount());
        user.followedAt = snapshot.followedAt();
        return user;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), profile, stats, verified, privateAccount, followedAt);
    }

    public void follow() {
        if (isFollowed()) {
            throw new AlreadyExistsException("ALREADY_FOLLOWED", "User " + profile.username() + " is already followed");
        }
        this.followedAt = Instant.now();
        record(new UserFollowed(id.value(), profile.username(), followedAt));
    }

    public void unfollow() {
        this.followedAt = null;
    }

    public void updateProfile(UserProfile newProfile) {
        Guard.requireNonNull("profile", newProfile);
        UserProfile oldProfile = this.profile;
        this.profile = newProfile;
        record(new UserProfileUpdated(id.value(), oldProfile, newProfile, Instant.now()));
    }

    public void updateStats(UserStats stats) {
        this.stats = Guard.requireNonNull("stats", stats);
    }

    public void verify() {
        this.verified = true;
    }

    public void makePrivate() {
        this.privateAccount = true;
    }

    public void makePublic() {
        this.privateAccount = false;
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
    public UserProfile getProfile() { return profile; }
    public UserStats getStats() { return stats; }
    public boolean isVerified() { return verified; }
    public boolean isPrivateAccount() { return privateAccount; }
    public Optional<Instant> getFollowedAt() { return Optional.ofNullable(followedAt); }

    public record Snapshot(
        String id,
        UserProfile profile,
        UserStats stats,
        boolean verified,
        boolean privateAccount,
        Instant followedAt
    ) {
    }
}
