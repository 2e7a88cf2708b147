package com.dpw.fixrunner.report;

import lombok.Value;

import java.nio.file.Path;

@Value
public class ReportFiles {
    Path resultFile;
    Path summaryFile;
}
