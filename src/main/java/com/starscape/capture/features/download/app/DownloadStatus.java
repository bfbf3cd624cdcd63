package com.starscape.capture.features.download.app;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.lifecycle.DownloadState;

import java.time.Instant;

public record DownloadStatus(
    String contentType,
    String id,
    DownloadState state,
    String localPath,
    Instant downloadedAt
) {

    static <A extends AggregateRoot<?> & Downloadable> DownloadStatus of(String contentType, A content) {
        return new DownloadStatus(
            contentType,
            content.getId().value(),
            content.getDownloadState(),
            content.getLocalPath().orElse(null),
            content.getDownloadedAt().orElse(null)
        );
    }
}
