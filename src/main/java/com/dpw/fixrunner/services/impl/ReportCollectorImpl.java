package com.dpw.fixrunner.services.impl;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import com.dpw.fixrunner.dto.CaseResultSummary;
import com.dpw.fixrunner.dto.RunReportResponse;
import com.dpw.fixrunner.exception.ReportNotFoundException;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;
import com.dpw.fixrunner.model.TestRun;
import com.dpw.fixrunner.repository.TestRunRepository;
import com.dpw.fixrunner.services.IReportCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReportCollectorImpl implements IReportCollector {

    private final TestRunRepository testRunRepository;
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("EEE, d MMM yyyy HH:mm:ss xx", Locale.ENGLISH);

    @Override
    public RunReportResponse getReportById(String runId, int page, int size) {
        log.info("Fetching report for ID: {} with pagination - page: {}, size: {}", runId, page, size);
        if (page < 0 || size <= 0) {
            throw new IllegalArgumentException("page must be >= 0 and size must be > 0");
        }

        TestRun testRun = findRun(runId);

        RunReportResponse response = new RunReportResponse();
        LocalDateTime reportTime = testRun.getExecutionEndTime() != null
                ? testRun.getExecutionEndTime()
                : testRun.getExecutionStartTime();
        if (reportTime != null) {
            response.setReportTimestamp(reportTime.atOffset(ZoneOffset.UTC).format(FORMATTER));
        }
        response.setStatus(testRun.getStatus());

        RunReportResponse.Overview overview = new RunReportResponse.Overview();
        overview.setExecutionTime(testRun.getExecutionDuration() != null ? testRun.getExecutionDuration() : "In Progress");
        overview.setTotal(testRun.getTotalCases());
        overview.setPassed(testRun.getPassedCases());
        overview.setFailed(testRun.getFailedCases());
        overview.setPending(testRun.getPendingCases());
        response.setOverview(overview);
        response.setExpansionErrors(testRun.getExpansionErrors());

        List<CaseResultSummary> paginatedResults = getPaginatedSummaries(testRun.getResults(), page, size);
        response.setExecutionDetails(paginatedResults);

        log.info("Report retrieved successfully for ID: {} with {} execution details", runId, paginatedResults.size());
        return response;
    }

    private List<CaseResultSummary> getPaginatedSummaries(List<CaseResult> results, int page, int size) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }

        int startIndex = page * size;
        int endIndex = Math.min(startIndex + size, results.size());

        if (startIndex >= results.size()) {
            return List.of();
        }

        return results.subList(startIndex, endIndex).stream()
                .map(this::convertToSummary)
                .toList();
    }

    private CaseResultSummary convertToSummary(CaseResult result) {
        CaseResultSummary summary = new CaseResultSummary();
        summary.setUseCaseId(result.getUseCaseId());
        summary.setTestCaseId(result.getTestCaseId());
        summary.setCorrelationId(result.getCorrelationKey() != null ? result.getCorrelationKey().getIdentifier() : null);
        summary.setMessageType(result.getMessageType());
        summary.setExecutedAt(result.getExecutedAt());
        summary.setResult(result.getOutcome() != null ? result.getOutcome().name() : null);
        summary.setFailureReason(result.getFailureReason() != null ? result.getFailureReason().name() : null);
        return summary;
    }

    @Override
    public CaseResult getTestCaseDetail(String runId, String testCaseId) {
        log.info("Fetching test case detail for report ID: {} and test case ID: {}", runId, testCaseId);

        TestRun testRun = findRun(runId);

        if (testRun.getResults() == null || testRun.getResults().isEmpty()) {
            throw new ReportNotFoundException("No results found for report ID: " + runId);
        }

        CaseResult result = testRun.getResults().stream()
                .filter(r -> testCaseId.equals(r.getTestCaseId()))
                .findFirst()
                .orElseThrow(() -> ReportNotFoundException.testCase(runId, testCaseId));

        log.info("Test case detail retrieved successfully for ID: {}", testCaseId);
        return result;
    }

    @Override
    public List<GroupSummary> getSummary(String runId, GroupingFacet facet) {
        TestRun testRun = findRun(runId);
        if (testRun.getSummaries() == null) {
            return List.of();
        }
        return testRun.getSummaries().getOrDefault(facet, List.of());
    }

    private TestRun findRun(String runId) {
        return testRunRepository.findById(runId)
                .orElseThrow(() -> ReportNotFoundException.run(runId));
    }
}
