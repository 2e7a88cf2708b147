package com.dpw.fixrunner.exception;

import com.dpw.fixrunner.model.FailureReason;

/**
 * Base type for failures that end a single case. The runner records them as FAIL and
 * moves on to the next case.
 */
public abstract class CaseExecutionException extends RuntimeException {

    protected CaseExecutionException(String message) {
        super(message);
    }

    protected CaseExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureReason getReason();
}
