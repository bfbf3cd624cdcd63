package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.instagram.domain.events.UserFollowed;
import com.starscape.capture.features.instagram.domain.events.UserProfileUpdated;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstagramUserTest {

    private static InstagramUser newUser() {
        UserProfile profile = new UserProfile("traveler", "The Traveler", "", null, null, null);
        return InstagramUser.create(UserId.of("user-1"), profile, new UserStats(100, 50, 10), false, false);
    }

    @Test
    void creationRecordsNoEvent() {
        assertTrue(newUser().getDomainEvents().isEmpty());
    }

    @Test
    void followTwiceIsRejected() {
        InstagramUser user = newUser();
        user.follow();

        InvalidStateException ex = assertThrows(AlreadyExistsException.class, user::follow);
        assertEquals("ALREADY_FOLLOWED", ex.getCode());
        assertEquals(1, user.pullDomainEvents().stream().filter(UserFollowed.class::isInstance).count());
    }

    @Test
    void unfollowAllowsFollowingAgain() {
        InstagramUser user = newUser();
        user.follow();
        user.unfollow();
        user.follow();

        assertTrue(user.isFollowed());
        assertEquals(2, user.pullDomainEvents().size());
    }

    @Test
    void profileUpdateCarriesOldAndNewProfile() {
        InstagramUser user = newUser();
        UserProfile updated = new UserProfile("traveler", "Traveler", "On the road", null, null, "Porto");

        user.updateProfile(updated);

        UserProfileUpdated event = assertInstanceOf(UserProfileUpdated.class, user.pullDomainEvents().get(0));
        assertEquals(updated, event.newProfile());
        assertEquals("The Traveler", event.oldProfile().displayName());
    }
}
