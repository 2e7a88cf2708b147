package com.dpw.fixrunner.services.impl;

import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.CaseTemplate;
import com.dpw.fixrunner.model.RunReport;
import com.dpw.fixrunner.model.RunRequest;
import com.dpw.fixrunner.model.TestRun;
import com.dpw.fixrunner.parser.CaseTemplateParser;
import com.dpw.fixrunner.repository.RunRequestRepository;
import com.dpw.fixrunner.repository.TestRunRepository;
import com.dpw.fixrunner.services.IExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

@Slf4j
@Service
public class ExecutorServiceImpl implements IExecutorService {

    private final SuiteRunner suiteRunner;
    private final CaseTemplateParser caseTemplateParser;
    private final TestRunRepository testRunRepository;
    private final RunRequestRepository runRequestRepository;
    private final ExecutorService runExecutor;
    private final Clock clock;

    private final Object updateLock = new Object();

    public ExecutorServiceImpl(SuiteRunner suiteRunner,
                               CaseTemplateParser caseTemplateParser,
                               TestRunRepository testRunRepository,
                               RunRequestRepository runRequestRepository,
                               @Qualifier("runExecutor") ExecutorService runExecutor,
                               Clock clock) {
        this.suiteRunner = suiteRunner;
        this.caseTemplateParser = caseTemplateParser;
        this.testRunRepository = testRunRepository;
        this.runRequestRepository = runRequestRepository;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<String> executeRun(RunRequest request) {
        return executeRunWithRealTimeUpdates(request, null);
    }

    public CompletableFuture<String> executeRunWithRealTimeUpdates(RunRequest request, TestRun existingRun) {
        return CompletableFuture.supplyAsync(() -> {
            LocalDateTime startTime = LocalDateTime.now(clock);
            log.info("Starting run execution: {}", request.describeInput());

            TestRun testRun = existingRun != null ? existingRun : new TestRun();
            if (testRun.getId() == null) {
                testRun.setId(request.getId());
            }
            testRun.setInputName(request.describeInput());
            testRun.setExecutionStartTime(startTime);
            testRun.setStatus("PROCESSING");
            testRun.setTotalCases(0);
            testRun.setPassedCases(0);
            testRun.setFailedCases(0);
            testRun.setPendingCases(0);
            testRun.setResults(new ArrayList<>());
            testRun.setExpansionErrors(new ArrayList<>());
            TestRun savedRun = testRunRepository.save(testRun);

            List<CaseTemplate> templates = loadTemplates(request);
            RunReport report = suiteRunner.run(templates, new PersistingRunListener(savedRun));

            LocalDateTime endTime = LocalDateTime.now(clock);
            synchronized (updateLock) {
                TestRun latestRun = testRunRepository.findById(savedRun.getId()).orElse(savedRun);
                latestRun.setExecutionEndTime(endTime);
                latestRun.setExecutionDuration(formatDuration(Duration.between(startTime, endTime)));
                latestRun.setResults(new ArrayList<>(report.getResults()));
                latestRun.setExpansionErrors(new ArrayList<>(report.getExpansionErrors()));
                latestRun.setSummaries(report.getSummaries());
                latestRun.setTotalCases(report.getResults().size());
                latestRun.setPassedCases((int) report.passedCount());
                latestRun.setFailedCases((int) report.failedCount());
                latestRun.setPendingCases(0);
                latestRun.setStatus("COMPLETED");
                savedRun = testRunRepository.save(latestRun);
            }

            log.info("Run execution completed: {} with {} cases", request.describeInput(), report.getResults().size());
            return savedRun.getId();
        }, runExecutor);
    }

    @KafkaListener(topics = "${fixrunner.kafka.topics.run-request}",
            autoStartup = "${fixrunner.kafka.listener-enabled:true}")
    public void processRunRequest(@Header(KafkaHeaders.RECEIVED_KEY) String runId,
                                  @Payload RunRequest request,
                                  Acknowledgment acknowledgment) {
        log.info("Received run request from Kafka with ID: {}", runId);

        try {
            request.setStatus("PROCESSING");
            runRequestRepository.save(request);

            TestRun initialRun = testRunRepository.findById(runId).orElseGet(() -> {
                TestRun run = new TestRun();
                run.setId(runId);
                return run;
            });

            executeRunAsync(request, initialRun);

            acknowledgment.acknowledge();
            log.debug("Message acknowledged for run ID: {}", runId);

        } catch (Exception e) {
            log.error("Error processing run request {}: {}", runId, e.getMessage());
            try {
                request.setStatus("FAILED");
                runRequestRepository.save(request);
                acknowledgment.acknowledge();
                log.debug("Message acknowledged after failure for run ID: {}", runId);
            } catch (Exception saveException) {
                log.error("Failed to save error status for run {}: {}", runId, saveException.getMessage());
                throw saveException;
            }
        }
    }

    private void executeRunAsync(RunRequest request, TestRun testRun) {
        executeRunWithRealTimeUpdates(request, testRun).whenComplete((runId, error) -> {
            if (error == null) {
                request.setStatus("COMPLETED");
                runRequestRepository.save(request);
                log.info("Completed asynchronous run: {} with result ID: {}", request.describeInput(), runId);
                return;
            }
            log.error("Error in asynchronous run for request {}: {}", request.getId(), error.getMessage());
            synchronized (updateLock) {
                TestRun latestRun = testRunRepository.findById(testRun.getId()).orElse(testRun);
                latestRun.setStatus("FAILED");
                testRunRepository.save(latestRun);
            }
            request.setStatus("FAILED");
            runRequestRepository.save(request);
        });
    }

    private List<CaseTemplate> loadTemplates(RunRequest request) {
        try {
            if (request.getInputFile() != null && !request.getInputFile().isBlank()) {
                return caseTemplateParser.parse(Paths.get(request.getInputFile()));
            }
            return caseTemplateParser.parseInline(request.getCsv() != null ? request.getCsv() : "");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read run input " + request.describeInput(), e);
        }
    }

    private String formatDuration(Duration duration) {
        return duration.toMillis() + "ms";
    }

    /**
     * Mirrors each finished case into the stored run so reports show progress while the
     * run is still executing.
     */
    private class PersistingRunListener implements SuiteRunner.RunListener {

        private static final int MAX_RETRIES = 3;

        private final TestRun testRun;

        PersistingRunListener(TestRun testRun) {
            this.testRun = testRun;
        }

        @Override
        public void onRowExpanded(CaseTemplate template, int caseCount) {
            update(latest -> {
                latest.setTotalCases(latest.getTotalCases() + caseCount);
                latest.setPendingCases(latest.getPendingCases() + caseCount);
            });
        }

        @Override
        public void onRowFailed(CaseTemplate template, String error) {
            update(latest -> latest.getExpansionErrors().add(error));
        }

        @Override
        public void onCaseCompleted(CaseResult result) {
            update(latest -> {
                boolean exists = latest.getResults().stream()
                        .anyMatch(r -> result.getTestCaseId().equals(r.getTestCaseId()));
                if (exists) {
                    log.debug("Result {} already stored, skipping duplicate update", result.getTestCaseId());
                    return;
                }
                latest.getResults().add(result);
                if (result.isPassed()) {
                    latest.setPassedCases(latest.getPassedCases() + 1);
                } else {
                    latest.setFailedCases(latest.getFailedCases() + 1);
                }
                latest.setPendingCases(Math.max(0, latest.getPendingCases() - 1));
            });
        }

        private void update(Consumer<TestRun> change) {
            synchronized (updateLock) {
                for (int retry = 0; retry < MAX_RETRIES; retry++) {
                    try {
                        TestRun latest = testRunRepository.findById(testRun.getId()).orElse(testRun);
                        change.accept(latest);
                        testRunRepository.save(latest);
                        return;
                    } catch (RuntimeException e) {
                        if (retry == MAX_RETRIES - 1) {
                            log.error("Failed to update run {} in real-time after {} retries: {}",
                                    testRun.getId(), MAX_RETRIES, e.getMessage());
                            return;
                        }
                        log.warn("Retry {} failed for run update: {}", retry + 1, e.getMessage());
                    }
                }
            }
        }
    }
}
