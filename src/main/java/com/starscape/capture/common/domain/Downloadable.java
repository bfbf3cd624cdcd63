package com.starscape.capture.common.domain;

import com.starscape.capture.common.domain.lifecycle.DownloadState;

import java.time.Instant;
import java.util.Optional;

/**
 * Captured content whose media can be fetched by the download consumer.
 */
public interface Downloadable {

    void requestDownload();

    void markAsDownloaded(String localPath);

    boolean isDownloaded();

    DownloadState getDownloadState();

    Optional<String> getLocalPath();

    Optional<Instant> getDownloadedAt();
}
