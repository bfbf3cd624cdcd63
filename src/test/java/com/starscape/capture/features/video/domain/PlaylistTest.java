package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.video.domain.events.PlaylistSynced;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaylistTest {

    private static final VideoId FIRST = VideoId.of("aaaaaaaaaaa");
    private static final VideoId SECOND = VideoId.of("bbbbbbbbbbb");

    private Playlist playlist;

    @BeforeEach
    void setUp() {
        playlist = Playlist.create(PlaylistId.of("PL" + "x".repeat(32)), "Talks", null,
                ChannelId.of(VideoTest.CHANNEL), true);
        playlist.pullDomainEvents();
    }

    @Test
    void addAndRemoveAreSilent() {
        playlist.addVideo(FIRST);
        playlist.addVideo(FIRST);
        playlist.addVideo(SECOND);
        playlist.removeVideo(FIRST);

        assertEquals(List.of(SECOND), playlist.getVideoIds());
        assertTrue(playlist.pullDomainEvents().isEmpty());
        assertThrows(InvalidStateException.class, () -> playlist.removeVideo(FIRST));
    }

    @Test
    void syncRecordsFullMembership() {
        playlist.addVideo(FIRST);

        playlist.syncVideos(List.of(SECOND, FIRST));

        PlaylistSynced synced = assertInstanceOf(PlaylistSynced.class, playlist.pullDomainEvents().get(0));
        assertEquals("playlist.synced", synced.getEventType());
        assertEquals(List.of("bbbbbbbbbbb", "aaaaaaaaaaa"), synced.videoIds());
        assertEquals(2, playlist.getVideoCount());
    }

    @Test
    void snapshotRoundTripKeepsOrder() {
        playlist.syncVideos(List.of(SECOND, FIRST));

        Playlist restored = Playlist.fromSnapshot(playlist.toSnapshot());

        assertEquals(playlist.getVideoIds(), restored.getVideoIds());
        assertTrue(restored.getLastSyncedAt().isPresent());
    }
}
