package com.dpw.fixrunner.dto;

import lombok.Data;
import java.time.LocalDateTime;

@Data
public class CaseResultSummary {
    private String useCaseId;
    private String testCaseId;
    private String correlationId;
    private String messageType;
    private LocalDateTime executedAt;
    private String result;
    private String failureReason;
}
