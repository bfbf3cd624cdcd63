package com.starscape.capture.common.exception;

public class AlreadyDownloadedException extends InvalidStateException {

    public AlreadyDownloadedException(String contentLabel) {
        super("ALREADY_DOWNLOADED", contentLabel + " is already downloaded");
    }
}
