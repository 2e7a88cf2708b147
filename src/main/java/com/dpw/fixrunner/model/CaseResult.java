package com.dpw.fixrunner.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class CaseResult {
    private String useCaseId;
    private String testCaseId;
    private String sourceTestCaseId;
    private CorrelationKey correlationKey;
    private Outcome outcome;
    private FailureReason failureReason; // null when passed
    private boolean expectedOutcome;
    private List<String> reasons = new ArrayList<>();
    private String sentMessage;
    private String receivedMessage;
    private LocalDateTime executedAt;

    public boolean isPassed() {
        return outcome == Outcome.PASS;
    }

    public String getMessageType() {
        return correlationKey != null ? correlationKey.getType() : null;
    }
}
