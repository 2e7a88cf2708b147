package com.dpw.fixrunner.model;

/**
 * Reason code recorded on a failed case.
 */
public enum FailureReason {
    VALIDATION_FAILED,
    UNEXPECTED_PASS,
    PLACEHOLDER_UNRESOLVED,
    MISSING_TYPE_TAG,
    TRANSMISSION_FAILED,
    CORRELATION_TIMEOUT,
    UNEXPECTED_ERROR
}
