package com.dpw.fixrunner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RunnerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Runs share the transport and the record store, so they execute one at a time
    @Bean(name = "runExecutor", destroyMethod = "shutdown")
    public ExecutorService runExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "fix-run");
            thread.setDaemon(false);
            return thread;
        });
    }
}
