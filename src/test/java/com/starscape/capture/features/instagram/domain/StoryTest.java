package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.exception.ExpiredContentException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.instagram.domain.events.StoryViewed;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StoryTest {

    private static Story story(Instant timestamp, Instant expiresAt) {
        StoryAttributes attributes = new StoryAttributes("https://cdn.example.com/s/1.jpg", MediaType.IMAGE,
                null, timestamp, expiresAt);
        Story story = Story.capture(StoryId.of("S1"), UserId.of("user-1"), attributes);
        story.pullDomainEvents();
        return story;
    }

    @Test
    void liveStoryCanBeViewed() {
        Instant now = Instant.now();
        Story story = story(now, now.plus(Duration.ofHours(24)));

        story.markAsViewed();

        assertFalse(story.isExpired());
        assertInstanceOf(StoryViewed.class, story.pullDomainEvents().get(0));
    }

    @Test
    void expiredStoryCannotBeViewed() {
        Instant now = Instant.now();
        Story story = story(now.minus(Duration.ofHours(25)), now.minusSeconds(1));

        assertTrue(story.isExpired());
        assertThrows(ExpiredContentException.class, story::markAsViewed);
        assertTrue(story.pullDomainEvents().isEmpty());
    }

    @Test
    void expiredStoryCanStillBeDownloaded() {
        Instant now = Instant.now();
        Story story = story(now.minus(Duration.ofHours(25)), now.minusSeconds(1));

        story.requestDownload();
        story.markAsDownloaded("/downloads/S1.jpg");

        assertTrue(story.isDownloaded());
    }

    @Test
    void archiveTwiceIsRejected() {
        Instant now = Instant.now();
        Story story = story(now, now.plus(Duration.ofHours(1)));
        story.archive();

        InvalidStateException ex = assertThrows(InvalidStateException.class, story::archive);
        assertEquals("ALREADY_ARCHIVED", ex.getCode());
    }

    @Test
    void expiryMustFollowTimestamp() {
        Instant now = Instant.now();
        ValidationException ex = assertThrows(ValidationException.class,
                () -> new StoryAttributes("https://x/1.jpg", MediaType.VIDEO, 15, now, now));
        assertEquals("expiresAt", ex.getField());
    }
}
