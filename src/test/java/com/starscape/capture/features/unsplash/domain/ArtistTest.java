package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.unsplash.domain.events.ArtistProfileUpdated;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArtistTest {

    private static Artist newArtist() {
        ArtistProfile profile = new ArtistProfile("jdoe", "Jane", "Doe", null, "Oslo", null, null, null, null);
        return Artist.create(ArtistId.of("artist-1"), profile, new ArtistStats(10, 100, 1000, 50, 20, 5), true, false);
    }

    @Test
    void fullNameJoinsFirstAndLastName() {
        assertEquals("Jane Doe", newArtist().getProfile().fullName());
    }

    @Test
    void followTwiceIsRejected() {
        Artist artist = newArtist();
        artist.follow();
        assertThrows(AlreadyExistsException.class, artist::follow);
        assertTrue(artist.isFollowed());
    }

    @Test
    void profileUpdateRecordsEventButAvailabilityDoesNot() {
        Artist artist = newArtist();
        artist.setForHire(false);
        artist.setAcceptsDonations(true);
        assertTrue(artist.pullDomainEvents().isEmpty());

        artist.updateProfile(new ArtistProfile("jdoe", "Jane", "Doe", "Landscapes", "Oslo",
                null, null, null, null));

        assertInstanceOf(ArtistProfileUpdated.class, artist.pullDomainEvents().get(0));
        assertFalse(artist.isForHire());
        assertTrue(artist.isAcceptsDonations());
    }
}
