package com.dpw.fixrunner.model;

import lombok.Builder;
import lombok.Value;

/**
 * One input row as read from the CSV file.
 */
@Value
@Builder
public class CaseTemplate {
    int rowNumber;
    String useCaseId;
    String testCaseId;
    String baseMessage;
    String updateSpec;
    String validateSpec;
    @Builder.Default
    boolean expectedOutcome = true;
}
