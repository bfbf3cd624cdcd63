package com.starscape.capture.common.exception;

public class ExpiredContentException extends InvalidStateException {

    public ExpiredContentException(String message) {
        super("EXPIRED_CONTENT", message);
    }
}
