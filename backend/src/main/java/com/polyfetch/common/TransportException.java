package com.polyfetch.common;

/**
 * Thrown when a backend cannot be reached or the connection fails mid-request.
 */
public class TransportException extends BackendException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
