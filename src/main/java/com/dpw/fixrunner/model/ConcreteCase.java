package com.dpw.fixrunner.model;

import com.dpw.fixrunner.validation.PatternCache;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A fully expanded case ready for execution. Update and validate maps may still
 * carry {@code ${...}} placeholders; they are resolved by the runner.
 */
@Value
@Builder(toBuilder = true)
public class ConcreteCase {
    String useCaseId;
    String testCaseId;
    String sourceTestCaseId;
    String baseMessage;
    Map<String, String> updateMap;
    Map<String, String> validateMap;
    boolean expectedOutcome;
    String correlationId;
    boolean chained;
    String parentCorrelationId;

    @JsonIgnore
    PatternCache patternCache;
}
