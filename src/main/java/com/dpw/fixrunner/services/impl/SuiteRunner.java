package com.dpw.fixrunner.services.impl;

import com.dpw.fixrunner.aggregator.ResultAggregator;
import com.dpw.fixrunner.exception.ExpansionException;
import com.dpw.fixrunner.generator.CaseExpansionEngine;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.CaseTemplate;
import com.dpw.fixrunner.model.ConcreteCase;
import com.dpw.fixrunner.model.RunReport;
import com.dpw.fixrunner.resolver.ResolvedRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a list of templates row by row, strictly in order. Each run gets its own
 * {@link ResolvedRegistry} and {@link ResultAggregator}. A row that cannot be expanded
 * is reported and skipped; a failing case never stops the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuiteRunner {

    private final CaseExpansionEngine caseExpansionEngine;
    private final CaseRunner caseRunner;

    public RunReport run(List<CaseTemplate> templates) {
        return run(templates, RunListener.NONE);
    }

    public RunReport run(List<CaseTemplate> templates, RunListener listener) {
        ResolvedRegistry registry = new ResolvedRegistry();
        ResultAggregator aggregator = new ResultAggregator();
        List<CaseResult> results = new ArrayList<>();
        List<String> expansionErrors = new ArrayList<>();

        for (CaseTemplate template : templates) {
            log.info("Processing input row {}: UseCaseID={}, TestCaseID={}",
                    template.getRowNumber(), template.getUseCaseId(), template.getTestCaseId());

            List<ConcreteCase> cases;
            try {
                cases = caseExpansionEngine.expand(template);
            } catch (ExpansionException e) {
                String error = String.format("Row %d (%s): %s", template.getRowNumber(), template.getTestCaseId(), e.getMessage());
                log.error("Expansion failed for {}", error);
                expansionErrors.add(error);
                listener.onRowFailed(template, error);
                continue;
            }
            listener.onRowExpanded(template, cases.size());

            int index = 0;
            for (ConcreteCase concreteCase : cases) {
                index++;
                CaseResult result = caseRunner.run(concreteCase, registry);
                aggregator.record(result);
                results.add(result);
                log.info("[{}/{}] UseCaseID: {}, TestCaseID: {}, Key: {} ... {}", index, cases.size(),
                        result.getUseCaseId(), result.getTestCaseId(), result.getCorrelationKey(), result.getOutcome());
                listener.onCaseCompleted(result);
            }
        }

        RunReport report = new RunReport(results, expansionErrors, aggregator.snapshotAll());
        log.info("Execution finished. Total Tests: {}, Passed: {}, Failed: {}, Rows rejected: {}",
                results.size(), report.passedCount(), report.failedCount(), expansionErrors.size());
        return report;
    }

    /**
     * Progress callbacks, invoked on the run thread.
     */
    public interface RunListener {

        RunListener NONE = new RunListener() {
        };

        default void onRowExpanded(CaseTemplate template, int caseCount) {
        }

        default void onRowFailed(CaseTemplate template, String error) {
        }

        default void onCaseCompleted(CaseResult result) {
        }
    }
}
