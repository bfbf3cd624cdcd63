package com.starscape.capture.common.exception;

/**
 * Raised when a command is not allowed in the aggregate's current lifecycle state.
 * The aggregate is left untouched and no event is recorded.
 */
public class InvalidStateException extends IllegalStateException {

    private final String code;

    public InvalidStateException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
