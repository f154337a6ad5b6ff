package com.polyfetch.common;

/**
 * Thrown when a backend answers with a payload whose shape does not match the expected record.
 */
public class DecodeException extends BackendException {

    public DecodeException(String message) {
        super(ErrorKind.DECODE_ERROR, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE_ERROR, message, cause);
    }
}
