package com.dpw.fixrunner.aggregator;

import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run Total/Passed/Failed counters for every {@link GroupingFacet}. Each result is
 * folded in exactly once; groups are reported in the order they were first seen.
 */
public class ResultAggregator {

    private final Map<GroupingFacet, Map<List<String>, GroupSummary>> groups = new EnumMap<>(GroupingFacet.class);
    private int recorded;

    public ResultAggregator() {
        for (GroupingFacet facet : GroupingFacet.values()) {
            groups.put(facet, new LinkedHashMap<>());
        }
    }

    public synchronized void record(CaseResult result) {
        for (GroupingFacet facet : GroupingFacet.values()) {
            GroupSummary summary = groups.get(facet).computeIfAbsent(facet.keyOf(result), key -> facet.emptySummary(result));
            summary.setTotal(summary.getTotal() + 1);
            if (result.isPassed()) {
                summary.setPassed(summary.getPassed() + 1);
            } else {
                summary.setFailed(summary.getFailed() + 1);
            }
        }
        recorded++;
    }

    public synchronized List<GroupSummary> snapshot(GroupingFacet facet) {
        List<GroupSummary> copy = new ArrayList<>();
        for (GroupSummary summary : groups.get(facet).values()) {
            copy.add(new GroupSummary(summary.getUseCaseId(), summary.getTestCaseId(), summary.getMessageType(),
                    summary.getTotal(), summary.getPassed(), summary.getFailed()));
        }
        return copy;
    }

    public synchronized Map<GroupingFacet, List<GroupSummary>> snapshotAll() {
        Map<GroupingFacet, List<GroupSummary>> all = new EnumMap<>(GroupingFacet.class);
        for (GroupingFacet facet : GroupingFacet.values()) {
            all.put(facet, snapshot(facet));
        }
        return all;
    }

    synchronized int getRecorded() {
        return recorded;
    }
}
