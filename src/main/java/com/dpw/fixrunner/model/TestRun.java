package com.dpw.fixrunner.model;

import com.dpw.fixrunner.aggregator.GroupingFacet;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Document(collection = "test_runs")
public class TestRun {
    @Id
    private String id;
    private String inputName;
    private LocalDateTime executionStartTime;
    private LocalDateTime executionEndTime;
    private String executionDuration;
    private Integer totalCases;
    private Integer passedCases;
    private Integer failedCases;
    private Integer pendingCases;
    private String status; // PENDING, PROCESSING, COMPLETED, FAILED
    private List<CaseResult> results = new ArrayList<>();
    private List<String> expansionErrors = new ArrayList<>();
    private Map<GroupingFacet, List<GroupSummary>> summaries = new EnumMap<>(GroupingFacet.class);
}
