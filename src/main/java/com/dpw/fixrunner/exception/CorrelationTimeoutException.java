package com.dpw.fixrunner.exception;

import com.dpw.fixrunner.model.CorrelationKey;
import com.dpw.fixrunner.model.FailureReason;
import lombok.Getter;

@Getter
public class CorrelationTimeoutException extends CaseExecutionException {

    private final CorrelationKey key;
    private final int attempts;

    public CorrelationTimeoutException(CorrelationKey key, int attempts) {
        super(String.format("No response found for %s after %d attempts", key, attempts));
        this.key = key;
        this.attempts = attempts;
    }

    @Override
    public FailureReason getReason() {
        return FailureReason.CORRELATION_TIMEOUT;
    }
}
