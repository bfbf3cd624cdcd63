package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.video.domain.events.VideoDownloadCompleted;
import com.starscape.capture.features.video.domain.events.VideoDownloadRequested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VideoTest {

    static final String CHANNEL = "UC_x5XG1OV2P6uZZ5FSM9Ttw";

    private static VideoMetadata metadata(long durationSeconds) {
        return new VideoMetadata("Conference keynote", null, durationSeconds, Instant.now(),
                ChannelId.of(CHANNEL), "Developers", null, 1000, 50, List.of("keynote"));
    }

    @Test
    void idFormatsAreEnforced() {
        assertEquals("dQw4w9WgXcQ", VideoId.of("dQw4w9WgXcQ").value());
        assertEquals("videoId", assertThrows(ValidationException.class, () -> VideoId.of("short")).getField());
        assertThrows(ValidationException.class, () -> ChannelId.of("UCtooShort"));
        assertThrows(ValidationException.class, () -> PlaylistId.of("PL123"));
    }

    @Test
    void durationIsFormatted() {
        assertEquals("4:05", metadata(245).formattedDuration());
        assertEquals("1:02:03", metadata(3723).formattedDuration());
        assertEquals("0:00", metadata(0).formattedDuration());
    }

    @Test
    void qualityParsesLabelsAndNames() {
        assertEquals(VideoQuality.FULL_HD, VideoQuality.fromValue("1080p"));
        assertEquals(VideoQuality.LOW, VideoQuality.fromValue("low"));
        assertTrue(VideoQuality.HIGH.isHighDefinition());
        assertFalse(VideoQuality.MEDIUM.isHighDefinition());
        assertThrows(ValidationException.class, () -> VideoQuality.fromValue("8k"));
    }

    @Test
    void downloadReportsRequestedQuality() {
        Video video = Video.capture(VideoId.of("dQw4w9WgXcQ"), metadata(245), VideoQuality.HIGH);
        video.pullDomainEvents();

        video.requestDownload(VideoQuality.FOUR_K);
        video.markAsDownloaded("/downloads/dQw4w9WgXcQ.mp4");

        List<DomainEvent> events = video.pullDomainEvents();
        VideoDownloadRequested requested = assertInstanceOf(VideoDownloadRequested.class, events.get(0));
        VideoDownloadCompleted completed = assertInstanceOf(VideoDownloadCompleted.class, events.get(1));
        assertEquals("video.download.requested", requested.getEventType());
        assertEquals(VideoQuality.FOUR_K, requested.quality());
        assertEquals(VideoQuality.FOUR_K, completed.quality());
        assertTrue(video.isDownloaded());
    }
}
