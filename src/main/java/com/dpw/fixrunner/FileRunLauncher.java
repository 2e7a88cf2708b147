package com.dpw.fixrunner;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.model.CaseTemplate;
import com.dpw.fixrunner.model.RunReport;
import com.dpw.fixrunner.parser.CaseTemplateParser;
import com.dpw.fixrunner.report.CsvReportWriter;
import com.dpw.fixrunner.report.ReportFiles;
import com.dpw.fixrunner.services.impl.SuiteRunner;
import com.dpw.fixrunner.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a single input file at startup when {@code fixrunner.input-file} is set and writes
 * the CSV result and summary files into the output directory.
 */
@Slf4j
@Component
public class FileRunLauncher implements ApplicationRunner {

    static final DateTimeFormatter EXECUTION_ID_FORMAT = DateTimeFormatter.ofPattern("yyMMdd_HHmmss");

    private final FixRunnerProperties properties;
    private final CaseTemplateParser parser;
    private final SuiteRunner suiteRunner;
    private final CsvReportWriter reportWriter;
    private final ExecutorService runExecutor;
    private final Clock clock;

    public FileRunLauncher(FixRunnerProperties properties,
                           CaseTemplateParser parser,
                           SuiteRunner suiteRunner,
                           CsvReportWriter reportWriter,
                           @Qualifier("runExecutor") ExecutorService runExecutor,
                           Clock clock) {
        this.properties = properties;
        this.parser = parser;
        this.suiteRunner = suiteRunner;
        this.reportWriter = reportWriter;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String inputFile = properties.getInputFile();
        if (inputFile == null || inputFile.isBlank()) {
            log.debug("No input file configured, waiting for run requests");
            return;
        }
        runFile(Paths.get(inputFile));
    }

    public ReportFiles runFile(Path inputFile) throws Exception {
        String executionId = LocalDateTime.now(clock).format(EXECUTION_ID_FORMAT);
        log.info("Starting file run {} for {}", executionId, inputFile);

        List<CaseTemplate> templates = parser.parse(inputFile);
        // single-thread executor: file runs and queued runs never overlap
        Future<RunReport> pending = runExecutor.submit(() -> suiteRunner.run(templates));
        RunReport report = pending.get();

        ReportFiles files = reportWriter.write(executionId, report);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("executionId", executionId);
        summary.put("rows", templates.size());
        summary.put("cases", report.getResults().size());
        summary.put("passed", report.passedCount());
        summary.put("failed", report.failedCount());
        summary.put("expansionErrors", report.getExpansionErrors().size());
        summary.put("resultFile", files.getResultFile().toString());
        summary.put("summaryFile", files.getSummaryFile().toString());
        log.info("File run finished:\n{}", JsonUtils.toPrettyJson(summary));
        return files;
    }
}
