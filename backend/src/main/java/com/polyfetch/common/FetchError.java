package com.polyfetch.common;

/**
 * Error descriptor carried by a failed {@link FetchResult}: kind, originating backend and message.
 */
public record FetchError(ErrorKind kind, String backend, String message) {

    public static FetchError of(ErrorKind kind, String backend, String message) {
        return new FetchError(kind, backend, message);
    }

    public static FetchError from(String backend, BackendException e) {
        return new FetchError(e.getErrorKind(), backend, e.getMessage());
    }

    @Override
    public String toString() {
        return kind + "[" + backend + "]: " + message;
    }
}
