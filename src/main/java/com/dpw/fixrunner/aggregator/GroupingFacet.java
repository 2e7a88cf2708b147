package com.dpw.fixrunner.aggregator;

import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;

import java.util.Arrays;
import java.util.List;

/**
 * Reporting facets. Each one groups case results by a different key.
 */
public enum GroupingFacet {
    USE_CASE(true, false, false),
    USE_CASE_MESSAGE_TYPE(true, false, true),
    USE_CASE_TEST_CASE_MESSAGE_TYPE(true, true, true);

    private final boolean byUseCase;
    private final boolean byTestCase;
    private final boolean byMessageType;

    GroupingFacet(boolean byUseCase, boolean byTestCase, boolean byMessageType) {
        this.byUseCase = byUseCase;
        this.byTestCase = byTestCase;
        this.byMessageType = byMessageType;
    }

    List<String> keyOf(CaseResult result) {
        return Arrays.asList(
                byUseCase ? result.getUseCaseId() : null,
                byTestCase ? result.getSourceTestCaseId() : null,
                byMessageType ? result.getMessageType() : null);
    }

    GroupSummary emptySummary(CaseResult result) {
        List<String> key = keyOf(result);
        return new GroupSummary(key.get(0), key.get(1), key.get(2), 0, 0, 0);
    }

    public static GroupingFacet fromName(String name) {
        try {
            return GroupingFacet.valueOf(name.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown grouping facet: " + name
                    + ", expected one of " + Arrays.toString(values()), e);
        }
    }
}
