package com.polyfetch.backend.relational;

import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;

/**
 * Thrown when the relational store refuses the API key, or none is configured.
 */
public class AuthException extends BackendException {

    public AuthException(String message) {
        super(ErrorKind.AUTH_ERROR, message);
    }

    public AuthException(String message, Throwable cause) {
        super(ErrorKind.AUTH_ERROR, message, cause);
    }
}
