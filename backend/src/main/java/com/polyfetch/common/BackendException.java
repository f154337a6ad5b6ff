package com.polyfetch.common;

/**
 * Base of all typed backend failures. Each subclass fixes its {@link ErrorKind}.
 */
public abstract class BackendException extends RuntimeException {

    private final ErrorKind errorKind;

    protected BackendException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected BackendException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
