package com.dpw.fixrunner.services;

import com.dpw.fixrunner.dto.RunSubmissionRequest;
import com.dpw.fixrunner.dto.RunSubmissionResponse;

public interface IRunSubmissionService {
    RunSubmissionResponse submit(RunSubmissionRequest submission);
}
