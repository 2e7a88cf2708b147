package com.dpw.fixrunner.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.CorrelationKey;
import com.dpw.fixrunner.model.FailureReason;
import com.dpw.fixrunner.model.GroupSummary;
import com.dpw.fixrunner.model.Outcome;
import com.dpw.fixrunner.model.RunReport;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesResultAndSummaryFiles() throws IOException {
        FixRunnerProperties properties = new FixRunnerProperties();
        properties.getOutput().setDirectory(tempDir.resolve("out").toString());

        CaseResult passed = new CaseResult();
        passed.setUseCaseId("UC1");
        passed.setTestCaseId("TC1");
        passed.setSourceTestCaseId("TC1");
        passed.setCorrelationKey(new CorrelationKey("TC1_1", "D"));
        passed.setOutcome(Outcome.PASS);
        passed.setExpectedOutcome(true);
        passed.setReasons(List.of("PASS: Tag 39 regex match successful [0]", "PASS: Tag 58 correctly deleted"));
        passed.setSentMessage("35=D|11=TC1_1");
        passed.setReceivedMessage("35=D|11=TC1_1|39=0");

        CaseResult failed = new CaseResult();
        failed.setUseCaseId("UC1");
        failed.setTestCaseId("TC2");
        failed.setSourceTestCaseId("TC2");
        failed.setOutcome(Outcome.FAIL);
        failed.setFailureReason(FailureReason.MISSING_TYPE_TAG);
        failed.setExpectedOutcome(false);
        failed.setReasons(List.of("Mandatory tag 35 missing"));

        Map<GroupingFacet, List<GroupSummary>> summaries = new EnumMap<>(GroupingFacet.class);
        summaries.put(GroupingFacet.USE_CASE, List.of(new GroupSummary("UC1", null, null, 2, 1, 1)));
        RunReport report = new RunReport(List.of(passed, failed), List.of(), summaries);

        ReportFiles files = new CsvReportWriter(properties).write("240102_030405", report);

        assertThat(files.getResultFile().getFileName().toString()).isEqualTo("test_result_240102_030405.csv");
        assertThat(files.getSummaryFile().getFileName().toString()).isEqualTo("test_summary_240102_030405.csv");

        List<CSVRecord> results = read(files.getResultFile());
        assertThat(results).hasSize(2);
        assertThat(results.get(0).get("ExecutionID")).isEqualTo("TC1_1");
        assertThat(results.get(0).get("ValidationResult")).isEqualTo("PASS");
        assertThat(results.get(0).get("ValidationDetails"))
                .isEqualTo("PASS: Tag 39 regex match successful [0] | PASS: Tag 58 correctly deleted");
        assertThat(results.get(0).get("ReceivedFixMessage")).isEqualTo("35=D|11=TC1_1|39=0");
        assertThat(results.get(1).get("ExecutionID")).isEqualTo("N/A");
        assertThat(results.get(1).get("MessageType")).isEqualTo("MISSING");
        assertThat(results.get(1).get("ExpectedResult")).isEqualTo("FAIL");
        assertThat(results.get(1).get("FailureReason")).isEqualTo("MISSING_TYPE_TAG");

        List<CSVRecord> summary = read(files.getSummaryFile());
        assertThat(summary).singleElement().satisfies(row -> {
            assertThat(row.get("Facet")).isEqualTo("USE_CASE");
            assertThat(row.get("Total")).isEqualTo("2");
            assertThat(row.get("Failed")).isEqualTo("1");
        });
    }

    private static List<CSVRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file)) {
            return CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
                    .parse(reader)
                    .getRecords();
        }
    }
}
