package com.starscape.capture.common.domain.lifecycle;

public enum DownloadState {
    CAPTURED,
    DOWNLOAD_REQUESTED,
    DOWNLOADED
}
