package com.polyfetch.aggregation;

import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;

/**
 * Thrown when the document store refuses the aggregate command (invalid stage, type mismatch, ...).
 */
public class PipelineRejectedException extends BackendException {

    public PipelineRejectedException(String message, Throwable cause) {
        super(ErrorKind.PIPELINE_REJECTED, message, cause);
    }
}
