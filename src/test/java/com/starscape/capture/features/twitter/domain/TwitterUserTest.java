package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.twitter.domain.events.UserFollowed;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TwitterUserTest {

    private static TwitterUser newUser() {
        TwitterProfile profile = new TwitterProfile("builder", null, null, null, null, null, null, null);
        return TwitterUser.create(UserId.of("42"), profile, new TwitterStats(10, 5, 100, 0), false, false);
    }

    @Test
    void displayNameFallsBackToUsername() {
        assertEquals("builder", newUser().getProfile().displayName());
    }

    @Test
    void secondFollowFails() {
        TwitterUser user = newUser();
        user.follow();

        assertThrows(InvalidStateException.class, user::follow);
        assertEquals(1, user.pullDomainEvents().stream().filter(UserFollowed.class::isInstance).count());
    }

    @Test
    void protectionToggleIsSilent() {
        TwitterUser user = newUser();
        user.protect();
        assertTrue(user.isProtectedAccount());
        user.unprotect();
        assertFalse(user.isProtectedAccount());
        assertTrue(user.pullDomainEvents().isEmpty());
    }

    @Test
    void snapshotKeepsFollowState() {
        TwitterUser user = newUser();
        user.follow();

        TwitterUser restored = TwitterUser.fromSnapshot(user.toSnapshot());

        assertTrue(restored.isFollowed());
        assertTrue(restored.getDomainEvents().isEmpty());
    }
}
