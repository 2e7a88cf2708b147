package com.dpw.fixrunner.exception;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String message) {
        super(message);
    }

    public static ReportNotFoundException run(String runId) {
        return new ReportNotFoundException("Report not found with ID: " + runId);
    }

    public static ReportNotFoundException testCase(String runId, String testCaseId) {
        return new ReportNotFoundException("Test case not found with ID: " + testCaseId + " in report: " + runId);
    }
}
