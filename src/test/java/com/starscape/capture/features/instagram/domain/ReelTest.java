package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.events.ReelShared;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReelTest {

    private Reel reel;

    @BeforeEach
    void setUp() {
        ReelAttributes attributes = new ReelAttributes("https://cdn.example.com/r/1.mp4",
                "https://cdn.example.com/r/1.jpg", "Dance", 30, 1000, 100, 10, 5,
                List.of("dance"), "Original audio", Instant.now());
        reel = Reel.capture(ReelId.of("Rx9"), UserId.of("user-1"), attributes);
        reel.pullDomainEvents();
    }

    @Test
    void shareIncrementsCounterAndRecordsEvent() {
        reel.share();

        List<DomainEvent> events = reel.pullDomainEvents();
        assertEquals(1, events.size());
        ReelShared shared = assertInstanceOf(ReelShared.class, events.get(0));
        assertEquals(6, shared.sharesCount());
        assertEquals(6, reel.getAttributes().sharesCount());
    }

    @Test
    void hashtagsAreIdempotent() {
        reel.addHashtag("music");
        reel.addHashtag("music");
        reel.removeHashtag("unknown");

        assertEquals(List.of("dance", "music"), reel.getAttributes().hashtags());
        assertTrue(reel.pullDomainEvents().isEmpty());
    }
}
