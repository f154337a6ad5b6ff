package com.polyfetch.common;

/**
 * Error taxonomy shared by all backends. Orchestrator-level kinds (TIMEOUT, UNEXPECTED) are never thrown by a backend.
 */
public enum ErrorKind {
    TRANSPORT_ERROR,
    AUTH_ERROR,
    DECODE_ERROR,
    PIPELINE_REJECTED,
    MALFORMED_SUMMARY,
    ACCOUNT_NOT_FOUND,
    BACKEND_UNAVAILABLE,
    TIMEOUT,
    UNEXPECTED
}
