package com.dpw.fixrunner.services;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import com.dpw.fixrunner.dto.RunReportResponse;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;

import java.util.List;

public interface IReportCollector {
    RunReportResponse getReportById(String runId, int page, int size);
    CaseResult getTestCaseDetail(String runId, String testCaseId);
    List<GroupSummary> getSummary(String runId, GroupingFacet facet);
}
