package com.dpw.fixrunner.exception;

import com.dpw.fixrunner.model.FailureReason;
import lombok.Getter;

@Getter
public class PlaceholderResolutionException extends CaseExecutionException {

    private final String token;

    public PlaceholderResolutionException(String token, String message) {
        super(message);
        this.token = token;
    }

    public static PlaceholderResolutionException unknownLocalTag(String token) {
        return new PlaceholderResolutionException(token, "Placeholder ${" + token + "} not found: tag is not present in the current message");
    }

    public static PlaceholderResolutionException notYetExecuted(String token, String testCaseId) {
        return new PlaceholderResolutionException(token,
                "Placeholder ${" + token + "} not found: test case " + testCaseId + " has not been executed yet");
    }

    public static PlaceholderResolutionException unknownReferencedTag(String token, String testCaseId, String tag) {
        return new PlaceholderResolutionException(token,
                "Placeholder ${" + token + "} not found: tag " + tag + " was not sent by test case " + testCaseId);
    }

    @Override
    public FailureReason getReason() {
        return FailureReason.PLACEHOLDER_UNRESOLVED;
    }
}
