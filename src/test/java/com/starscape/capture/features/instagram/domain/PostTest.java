package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.common.exception.AlreadyDownloadedException;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.instagram.domain.events.PostDownloadRequested;
import com.starscape.capture.features.instagram.domain.events.PostDownloaded;
import com.starscape.capture.features.instagram.domain.events.PostSaved;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostTest {

    private static PostMetadata metadata(boolean video, String videoUrl) {
        return new PostMetadata("Sunset over the bay", "https://cdn.example.com/p/1.jpg", null,
                10, 2, List.of("sunset"), "Lisbon", Instant.parse("2024-05-01T10:00:00Z"), video, videoUrl);
    }

    private static Post newPost() {
        return Post.capture(PostId.of("C1a2B3"), UserId.of("user-1"), metadata(false, null));
    }

    @Test
    void captureRecordsSavedEvent() {
        Post post = newPost();

        List<DomainEvent> events = post.pullDomainEvents();
        assertEquals(1, events.size());
        assertInstanceOf(PostSaved.class, events.get(0));
        assertEquals("instagram.post.saved", events.get(0).getEventType());
        assertEquals("C1a2B3", events.get(0).getAggregateId());
        assertEquals(DownloadState.CAPTURED, post.getDownloadState());
        assertTrue(post.pullDomainEvents().isEmpty());
    }

    @Test
    void videoPostWithoutVideoUrlIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> metadata(true, null));
        assertEquals("videoUrl", ex.getField());
    }

    @Test
    void negativeCountersAreRejected() {
        assertThrows(ValidationException.class, () -> new PostMetadata("c", "https://x/1.jpg", null,
                -1, 0, List.of(), null, Instant.now(), false, null));
    }

    @Test
    void downloadFlowRecordsOneEventPerTransition() {
        Post post = newPost();
        post.pullDomainEvents();

        post.requestDownload();
        post.markAsDownloaded("/downloads/C1a2B3.jpg");

        List<DomainEvent> events = post.pullDomainEvents();
        assertEquals(2, events.size());
        assertInstanceOf(PostDownloadRequested.class, events.get(0));
        assertInstanceOf(PostDownloaded.class, events.get(1));
        assertTrue(post.isDownloaded());
        assertEquals("/downloads/C1a2B3.jpg", post.getLocalPath().orElseThrow());
    }

    @Test
    void downloadedPostRejectsFurtherDownloadCommandsWithoutEvents() {
        Post post = newPost();
        post.markAsDownloaded("/downloads/a.jpg");
        post.pullDomainEvents();

        assertThrows(AlreadyDownloadedException.class, post::requestDownload);
        assertThrows(AlreadyDownloadedException.class, () -> post.markAsDownloaded("/downloads/b.jpg"));
        assertTrue(post.pullDomainEvents().isEmpty());
        assertEquals("/downloads/a.jpg", post.getLocalPath().orElseThrow());
    }

    @Test
    void engagementRefreshIsSilent() {
        Post post = newPost();
        post.pullDomainEvents();

        post.updateEngagement(500, 40);

        assertEquals(500, post.getMetadata().likesCount());
        assertEquals(40, post.getMetadata().commentsCount());
        assertTrue(post.pullDomainEvents().isEmpty());
    }

    @Test
    void snapshotRestoresDownloadStateWithoutEvents() {
        Post post = newPost();
        post.requestDownload();
        post.markAsDownloaded("/downloads/a.jpg");

        Post restored = Post.fromSnapshot(post.toSnapshot());

        assertTrue(restored.isDownloaded());
        assertEquals(post.getId(), restored.getId());
        assertTrue(restored.getDomainEvents().isEmpty());
    }
}
