package com.dpw.fixrunner.model;

public enum Outcome {
    PASS,
    FAIL
}
