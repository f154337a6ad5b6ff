package com.polyfetch.aggregation;

import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;

/**
 * Thrown when no connection to the document store can be established.
 */
public class BackendUnavailableException extends BackendException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
