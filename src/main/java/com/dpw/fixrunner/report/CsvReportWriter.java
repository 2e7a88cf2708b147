package com.dpw.fixrunner.report;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;
import com.dpw.fixrunner.model.RunReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-case result file and the per-group summary file of a run.
 */
@Slf4j
@Component
public class CsvReportWriter {

    static final String[] RESULT_HEADER = {
            "UseCaseID", "TestCaseID", "ExecutionID", "MessageType", "ExpectedResult", "ValidationResult",
            "FailureReason", "ValidationDetails", "SentFixMessage", "ReceivedFixMessage"
    };

    static final String[] SUMMARY_HEADER = {
            "Facet", "UseCaseID", "TestCaseID", "MessageType", "Total", "Passed", "Failed"
    };

    private final FixRunnerProperties properties;

    public CsvReportWriter(FixRunnerProperties properties) {
        this.properties = properties;
    }

    public ReportFiles write(String executionId, RunReport report) throws IOException {
        Path outputDir = Paths.get(properties.getOutput().getDirectory());
        Files.createDirectories(outputDir);

        Path resultFile = outputDir.resolve("test_result_" + executionId + ".csv");
        Path summaryFile = outputDir.resolve("test_summary_" + executionId + ".csv");

        writeResults(resultFile, report.getResults());
        writeSummary(summaryFile, report.getSummaries());

        log.info("Result File: {}", resultFile);
        log.info("Summary File: {}", summaryFile);
        return new ReportFiles(resultFile, summaryFile);
    }

    void writeResults(Path file, List<CaseResult> results) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(RESULT_HEADER).build();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (CaseResult result : results) {
                printer.printRecord(
                        result.getUseCaseId(),
                        result.getTestCaseId(),
                        result.getCorrelationKey() != null ? result.getCorrelationKey().getIdentifier() : "N/A",
                        result.getMessageType() != null ? result.getMessageType() : "MISSING",
                        result.isExpectedOutcome() ? "PASS" : "FAIL",
                        result.getOutcome(),
                        result.getFailureReason() != null ? result.getFailureReason() : "",
                        String.join(" | ", result.getReasons()),
                        nullToEmpty(result.getSentMessage()),
                        nullToEmpty(result.getReceivedMessage()));
            }
        }
    }

    void writeSummary(Path file, Map<GroupingFacet, List<GroupSummary>> summaries) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(SUMMARY_HEADER).build();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Map.Entry<GroupingFacet, List<GroupSummary>> entry : summaries.entrySet()) {
                for (GroupSummary summary : entry.getValue()) {
                    printer.printRecord(
                            entry.getKey(),
                            nullToEmpty(summary.getUseCaseId()),
                            nullToEmpty(summary.getTestCaseId()),
                            nullToEmpty(summary.getMessageType()),
                            summary.getTotal(),
                            summary.getPassed(),
                            summary.getFailed());
                }
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
