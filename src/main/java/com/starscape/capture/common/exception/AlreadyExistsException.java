package com.starscape.capture.common.exception;

/**
 * Explicit duplicate of a one-shot action, such as following an account twice.
 */
public class AlreadyExistsException extends InvalidStateException {

    public AlreadyExistsException(String code, String message) {
        super(code, message);
    }
}
