package com.dpw.fixrunner.model;

import lombok.Value;

import java.util.List;

@Value
public class ValidationOutcome {
    boolean passed;
    List<String> reasons;
}
