package com.dpw.fixrunner.exception;

import com.dpw.fixrunner.model.FailureReason;

public class TransmissionException extends CaseExecutionException {

    public TransmissionException(String message) {
        super(message);
    }

    public TransmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureReason getReason() {
        return FailureReason.TRANSMISSION_FAILED;
    }
}
