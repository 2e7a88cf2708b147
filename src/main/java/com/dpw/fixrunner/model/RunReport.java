package com.dpw.fixrunner.model;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything a finished run produced.
 */
@Value
public class RunReport {
    List<CaseResult> results;
    List<String> expansionErrors;
    Map<GroupingFacet, List<GroupSummary>> summaries;

    public long passedCount() {
        return results.stream().filter(CaseResult::isPassed).count();
    }

    public long failedCount() {
        return results.size() - passedCount();
    }
}
