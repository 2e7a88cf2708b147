package com.dpw.fixrunner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters for one group key of a reporting facet. Key parts that the facet does not
 * group by are left null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GroupSummary {
    private String useCaseId;
    private String testCaseId;
    private String messageType;
    private int total;
    private int passed;
    private int failed;
}
