package com.polyfetch.aggregation.summary;

import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;

/**
 * Thrown when a result document lacks its group key or carries a field of an unexpected type.
 */
public class MalformedSummaryException extends BackendException {

    public MalformedSummaryException(String message) {
        super(ErrorKind.MALFORMED_SUMMARY, message);
    }

    public MalformedSummaryException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_SUMMARY, message, cause);
    }
}
