package com.dpw.fixrunner.controller;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import com.dpw.fixrunner.dto.RunReportResponse;
import com.dpw.fixrunner.dto.RunSubmissionRequest;
import com.dpw.fixrunner.dto.RunSubmissionResponse;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.GroupSummary;
import com.dpw.fixrunner.services.IReportCollector;
import com.dpw.fixrunner.services.IRunSubmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping
@RequiredArgsConstructor
public class RunController {

    private final IRunSubmissionService runSubmissionService;
    private final IReportCollector reportCollector;

    @PostMapping("/runs")
    public ResponseEntity<RunSubmissionResponse> submitRun(@RequestBody RunSubmissionRequest request) {
        log.info("Received run submission");
        RunSubmissionResponse response = runSubmissionService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/report/{runId}")
    public ResponseEntity<RunReportResponse> getReportById(
            @PathVariable String runId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        log.info("Received report request for run {}", runId);
        return ResponseEntity.ok(reportCollector.getReportById(runId, page, size));
    }

    @GetMapping("/report/{runId}/cases/{testCaseId}")
    public ResponseEntity<CaseResult> getTestCaseDetail(@PathVariable String runId, @PathVariable String testCaseId) {
        return ResponseEntity.ok(reportCollector.getTestCaseDetail(runId, testCaseId));
    }

    @GetMapping("/report/{runId}/summary")
    public ResponseEntity<List<GroupSummary>> getSummary(
            @PathVariable String runId,
            @RequestParam(defaultValue = "USE_CASE") String facet) {
        return ResponseEntity.ok(reportCollector.getSummary(runId, GroupingFacet.fromName(facet)));
    }
}
