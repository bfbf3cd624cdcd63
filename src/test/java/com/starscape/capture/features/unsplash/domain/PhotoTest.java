package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.unsplash.domain.events.PhotoDownloaded;
import com.starscape.capture.features.unsplash.domain.events.PhotoLiked;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhotoTest {

    private Photo photo;

    @BeforeEach
    void setUp() {
        PhotoAttributes attributes = new PhotoAttributes("Fog", null, "https://unsplash.com/photos/abc",
                "https://unsplash.com/photos/abc/download", "https://images.unsplash.com/abc?w=200",
                4000, 3000, "#aabbcc", 10, 3, List.of("fog"), Instant.now());
        photo = Photo.capture(PhotoId.of("abc"), ArtistId.of("artist-1"), attributes);
        photo.pullDomainEvents();
    }

    @Test
    void likeOnlyOnce() {
        photo.like();

        assertInstanceOf(PhotoLiked.class, photo.pullDomainEvents().get(0));
        assertThrows(AlreadyExistsException.class, photo::like);
        assertTrue(photo.pullDomainEvents().isEmpty());
    }

    @Test
    void tagsAreDeduplicated() {
        photo.addTag("mist");
        photo.addTag("mist");
        photo.removeTag("fog");

        assertEquals(List.of("mist"), photo.getAttributes().tags());
    }

    @Test
    void completionIsRecordedOnce() {
        photo.requestDownload();
        photo.markAsDownloaded("/downloads/abc.jpg");

        assertEquals(1, photo.pullDomainEvents().stream().filter(PhotoDownloaded.class::isInstance).count());
        assertTrue(photo.isDownloaded());
    }
}
