package com.starscape.capture.common.domain.lifecycle;

import com.starscape.capture.common.exception.AlreadyDownloadedException;
import com.starscape.capture.common.exception.ValidationException;

import java.time.Instant;
import java.util.Optional;

/**
 * Captured → DownloadRequested → Downloaded, owned by one downloadable aggregate.
 * <p>
 * Requests may repeat until the download completes. Completion happens at most once:
 * the guard is the presence of {@code downloadedAt}, so a replayed completion notice
 * is rejected instead of producing a second terminal event.
 */
public final class DownloadLifecycle {

    private DownloadState state;
    private Instant lastRequestedAt;
    private String localPath;
    private Instant downloadedAt;

    private DownloadLifecycle(DownloadState state, Instant lastRequestedAt, String localPath, Instant downloadedAt) {
        this.state = state;
        this.lastRequestedAt = lastRequestedAt;
        this.localPath = localPath;
        this.downloadedAt = downloadedAt;
    }

    public static DownloadLifecycle captured() {
        return new DownloadLifecycle(DownloadState.CAPTURED, null, null, null);
    }

    /**
     * Rebuild from persisted timestamps. The state is derived, never stored.
     */
    public static DownloadLifecycle restore(Instant lastRequestedAt, String localPath, Instant downloadedAt) {
        if ((localPath == null) != (downloadedAt == null)) {
            throw new ValidationException("localPath", "localPath and downloadedAt must be restored together");
        }
        DownloadState state;
        if (downloadedAt != null) {
            state = DownloadState.DOWNLOADED;
        } else if (lastRequestedAt != null) {
            state = DownloadState.DOWNLOAD_REQUESTED;
        } else {
            state = DownloadState.CAPTURED;
        }
        return new DownloadLifecycle(state, lastRequestedAt, localPath, downloadedAt);
    }

    public Instant requestDownload(String contentLabel) {
        if (state == DownloadState.DOWNLOADED) {
            throw new AlreadyDownloadedException(contentLabel);
        }
        Instant now = Instant.now();
        this.lastRequestedAt = now;
        this.state = DownloadState.DOWNLOAD_REQUESTED;
        return now;
    }

    public Instant markDownloaded(String contentLabel, String localPath) {
        if (state == DownloadState.DOWNLOADED) {
            throw new AlreadyDownloadedException(contentLabel);
        }
        if (localPath == null || localPath.isBlank()) {
            throw new ValidationException("localPath", "localPath must be a non-empty string");
        }
        Instant now = Instant.now();
        this.localPath = localPath;
        this.downloadedAt = now;
        this.state = DownloadState.DOWNLOADED;
        return now;
    }

    public DownloadState state() {
        return state;
    }

    public boolean isDownloaded() {
        return state == DownloadState.DOWNLOADED;
    }

    public Optional<Instant> lastRequestedAt() {
        return Optional.ofNullable(lastRequestedAt);
    }

    public Optional<String> localPath() {
        return Optional.ofNullable(localPath);
    }

    public Optional<Instant> downloadedAt() {
        return Optional.ofNullable(downloadedAt);
    }
}
