package com.dpw.fixrunner.services.impl;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.dto.RunSubmissionRequest;
import com.dpw.fixrunner.dto.RunSubmissionResponse;
import com.dpw.fixrunner.model.RunRequest;
import com.dpw.fixrunner.model.TestRun;
import com.dpw.fixrunner.repository.RunRequestRepository;
import com.dpw.fixrunner.repository.TestRunRepository;
import com.dpw.fixrunner.services.IRunSubmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Stores a new run and queues it on Kafka. The run itself is picked up by
 * {@link ExecutorServiceImpl#processRunRequest}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunSubmissionServiceImpl implements IRunSubmissionService {

    private final RunRequestRepository runRequestRepository;
    private final TestRunRepository testRunRepository;
    private final KafkaTemplate<String, RunRequest> kafkaTemplate;
    private final FixRunnerProperties properties;
    private final Clock clock;

    @Override
    public RunSubmissionResponse submit(RunSubmissionRequest submission) {
        boolean hasFile = submission != null && submission.getInputFile() != null && !submission.getInputFile().isBlank();
        boolean hasCsv = submission != null && submission.getCsv() != null && !submission.getCsv().isBlank();
        if (!hasFile && !hasCsv) {
            throw new IllegalArgumentException("Either inputFile or csv must be provided");
        }

        RunRequest request = new RunRequest();
        request.setId(UUID.randomUUID().toString());
        request.setInputFile(hasFile ? submission.getInputFile() : null);
        request.setCsv(hasFile ? null : submission.getCsv());
        request.setCreatedAt(LocalDateTime.now(clock));
        request.setStatus("PENDING");
        runRequestRepository.save(request);

        TestRun run = new TestRun();
        run.setId(request.getId());
        run.setInputName(request.describeInput());
        run.setStatus("PENDING");
        run.setTotalCases(0);
        run.setPassedCases(0);
        run.setFailedCases(0);
        run.setPendingCases(0);
        testRunRepository.save(run);

        kafkaTemplate.send(properties.getKafka().getTopics().getRunRequest(), request.getId(), request);
        log.info("Queued run {} for input {}", request.getId(), request.describeInput());

        return new RunSubmissionResponse(request.getId(), request.getStatus());
    }
}
