package com.dpw.fixrunner.dto;

import lombok.Data;
import java.util.List;

@Data
public class RunReportResponse {
    private String reportTimestamp;
    private String status;
    private Overview overview;
    private List<String> expansionErrors;
    private List<CaseResultSummary> executionDetails;

    @Data
    public static class Overview {
        private String executionTime;
        private Integer total;
        private Integer passed;
        private Integer failed;
        private Integer pending;
    }

}
