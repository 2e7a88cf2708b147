package com.dpw.fixrunner.dto;

import lombok.Data;

@Data
public class RunSubmissionRequest {
    private String inputFile;
    private String csv;
}
