package com.dpw.fixrunner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunSubmissionResponse {
    private String runId;
    private String status;
}
