package com.dpw.fixrunner.services;

import com.dpw.fixrunner.model.RunRequest;
import java.util.concurrent.CompletableFuture;

public interface IExecutorService {
    CompletableFuture<String> executeRun(RunRequest request);
}
