package com.dpw.fixrunner.generator;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Produces identifier tag values of the form {@code <testCaseId>_<8 hex chars>}.
 */
@Component
public class CorrelationIdGenerator {

    private static final int SUFFIX_LENGTH = 8;

    public String next(String testCaseId) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
        return testCaseId + "_" + suffix;
    }
}
