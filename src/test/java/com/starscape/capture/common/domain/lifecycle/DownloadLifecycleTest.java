package com.starscape.capture.common.domain.lifecycle;

import com.starscape.capture.common.exception.AlreadyDownloadedException;
import com.starscape.capture.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DownloadLifecycleTest {

    @Test
    void requestThenCompleteReachesDownloaded() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        assertEquals(DownloadState.CAPTURED, lifecycle.state());

        lifecycle.requestDownload("Post 1");
        assertEquals(DownloadState.DOWNLOAD_REQUESTED, lifecycle.state());
        assertTrue(lifecycle.lastRequestedAt().isPresent());

        lifecycle.markDownloaded("Post 1", "/downloads/1.jpg");
        assertTrue(lifecycle.isDownloaded());
        assertEquals("/downloads/1.jpg", lifecycle.localPath().orElseThrow());
        assertTrue(lifecycle.downloadedAt().isPresent());
    }

    @Test
    void repeatedRequestsAreToleratedBeforeCompletion() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        lifecycle.requestDownload("Post 1");
        lifecycle.requestDownload("Post 1");
        assertEquals(DownloadState.DOWNLOAD_REQUESTED, lifecycle.state());
    }

    @Test
    void completionIsAcceptedWithoutPriorRequest() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        lifecycle.markDownloaded("Post 1", "/downloads/1.jpg");
        assertTrue(lifecycle.isDownloaded());
    }

    @Test
    void secondCompletionIsRejectedAndKeepsFirstPath() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        lifecycle.markDownloaded("Post 1", "/first.jpg");

        assertThrows(AlreadyDownloadedException.class, () -> lifecycle.markDownloaded("Post 1", "/second.jpg"));
        assertEquals("/first.jpg", lifecycle.localPath().orElseThrow());
    }

    @Test
    void requestAfterCompletionIsRejected() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        lifecycle.markDownloaded("Post 1", "/first.jpg");

        AlreadyDownloadedException ex = assertThrows(AlreadyDownloadedException.class,
                () -> lifecycle.requestDownload("Post 1"));
        assertEquals("ALREADY_DOWNLOADED", ex.getCode());
    }

    @Test
    void blankLocalPathIsRejected() {
        DownloadLifecycle lifecycle = DownloadLifecycle.captured();
        ValidationException ex = assertThrows(ValidationException.class,
                () -> lifecycle.markDownloaded("Post 1", " "));
        assertEquals("localPath", ex.getField());
        assertFalse(lifecycle.isDownloaded());
    }

    @Test
    void restoreDerivesStateFromTimestamps() {
        Instant now = Instant.now();
        assertEquals(DownloadState.CAPTURED, DownloadLifecycle.restore(null, null, null).state());
        assertEquals(DownloadState.DOWNLOAD_REQUESTED, DownloadLifecycle.restore(now, null, null).state());
        assertEquals(DownloadState.DOWNLOADED, DownloadLifecycle.restore(now, "/a.jpg", now).state());
        assertThrows(ValidationException.class, () -> DownloadLifecycle.restore(now, "/a.jpg", null));
    }
}
