package com.dpw.fixrunner.services.impl;

import com.dpw.fixrunner.codec.TagCodec;
import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.CaseExecutionException;
import com.dpw.fixrunner.exception.PlaceholderResolutionException;
import com.dpw.fixrunner.model.CaseResult;
import com.dpw.fixrunner.model.ConcreteCase;
import com.dpw.fixrunner.model.CorrelationKey;
import com.dpw.fixrunner.model.FailureReason;
import com.dpw.fixrunner.model.Outcome;
import com.dpw.fixrunner.model.ValidationOutcome;
import com.dpw.fixrunner.resolver.PlaceholderResolver;
import com.dpw.fixrunner.resolver.ResolvedRegistry;
import com.dpw.fixrunner.transport.MessageTransport;
import com.dpw.fixrunner.transport.Reply;
import com.dpw.fixrunner.transport.ReplyCorrelator;
import com.dpw.fixrunner.validation.TagValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Executes one expanded case: builds and sends the outbound message, waits for the
 * correlated reply and validates it. Never throws; every failure becomes a FAIL result.
 */
@Slf4j
@Component
public class CaseRunner {

    private final FixRunnerProperties properties;
    private final PlaceholderResolver placeholderResolver;
    private final MessageTransport messageTransport;
    private final ReplyCorrelator replyCorrelator;
    private final TagValidator tagValidator;
    private final Clock clock;
    private final DateTimeFormatter timestampFormatter;

    public CaseRunner(FixRunnerProperties properties,
                      PlaceholderResolver placeholderResolver,
                      MessageTransport messageTransport,
                      ReplyCorrelator replyCorrelator,
                      TagValidator tagValidator,
                      Clock clock) {
        this.properties = properties;
        this.placeholderResolver = placeholderResolver;
        this.messageTransport = messageTransport;
        this.replyCorrelator = replyCorrelator;
        this.tagValidator = tagValidator;
        this.clock = clock;
        this.timestampFormatter = DateTimeFormatter.ofPattern(properties.getTags().getTimestampPattern());
    }

    public CaseResult run(ConcreteCase concreteCase, ResolvedRegistry registry) {
        FixRunnerProperties.Tags tags = properties.getTags();
        CaseResult result = new CaseResult();
        result.setUseCaseId(concreteCase.getUseCaseId());
        result.setTestCaseId(concreteCase.getTestCaseId());
        result.setSourceTestCaseId(concreteCase.getSourceTestCaseId());
        result.setExpectedOutcome(concreteCase.isExpectedOutcome());
        result.setExecutedAt(LocalDateTime.now(clock));
        result.setCorrelationKey(new CorrelationKey(concreteCase.getCorrelationId(), concreteCase.getUpdateMap().get(tags.getType())));

        Map<String, String> outbound;
        try {
            outbound = buildOutbound(concreteCase, registry);
        } catch (PlaceholderResolutionException e) {
            log.warn("Placeholder resolution failed for {}: {}", concreteCase.getTestCaseId(), e.getMessage());
            return fail(result, e.getReason(), "Placeholder resolution failed: " + e.getMessage());
        }

        CorrelationKey key = new CorrelationKey(outbound.get(tags.getIdentifier()), outbound.get(tags.getType()));
        result.setCorrelationKey(key);
        result.setSentMessage(TagCodec.encode(outbound, properties.getFieldDelimiter()));
        registry.register(concreteCase.getTestCaseId(), outbound);
        log.info("Updated FIX message for {}: {}", concreteCase.getTestCaseId(), result.getSentMessage());

        if (key.getType() == null || key.getType().isEmpty()) {
            return fail(result, FailureReason.MISSING_TYPE_TAG, "Mandatory tag " + tags.getType() + " missing");
        }

        try {
            messageTransport.send(TagCodec.encode(outbound, properties.getWireDelimiter()));
            Reply reply = replyCorrelator.awaitReply(key);
            result.setReceivedMessage(TagCodec.convert(reply.getRaw(), properties.getWireDelimiter(), properties.getFieldDelimiter()));

            Map<String, String> expected;
            try {
                expected = placeholderResolver.resolveAll(concreteCase.getValidateMap(), reply.getFields(), registry);
            } catch (PlaceholderResolutionException e) {
                log.warn("Validation placeholder resolution failed for {}: {}", concreteCase.getTestCaseId(), e.getMessage());
                return fail(result, e.getReason(), "Validation placeholder resolution failed: " + e.getMessage());
            }

            ValidationOutcome validation = tagValidator.validate(expected, reply.getFields(), concreteCase.getPatternCache());
            validation.getReasons().forEach(reason -> log.debug("[{}] {}", concreteCase.getTestCaseId(), reason));
            result.setReasons(validation.getReasons());

            boolean passed = validation.isPassed() == concreteCase.isExpectedOutcome();
            result.setOutcome(passed ? Outcome.PASS : Outcome.FAIL);
            if (!passed) {
                result.setFailureReason(validation.isPassed() ? FailureReason.UNEXPECTED_PASS : FailureReason.VALIDATION_FAILED);
            }
            return result;
        } catch (CaseExecutionException e) {
            log.warn("Test case {} failed with {}: {}", concreteCase.getTestCaseId(), e.getReason(), e.getMessage());
            return fail(result, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error executing test case {}: {}", concreteCase.getTestCaseId(), e.getMessage(), e);
            return fail(result, FailureReason.UNEXPECTED_ERROR, "Execution Error: " + e.getMessage());
        }
    }

    /**
     * Applies the case's updates to its base message in order. Each value is resolved
     * against the message built so far; an empty value removes the tag. The case's
     * identifier, and the parent reference of a chained case, are in place before the
     * first update so {@code ${11}} and {@code ${41}} resolve to them.
     */
    Map<String, String> buildOutbound(ConcreteCase concreteCase, ResolvedRegistry registry) {
        FixRunnerProperties.Tags tags = properties.getTags();
        Map<String, String> message = TagCodec.decode(concreteCase.getBaseMessage(), properties.getFieldDelimiter());

        if (!isBlank(concreteCase.getCorrelationId())) {
            message.put(tags.getIdentifier(), concreteCase.getCorrelationId());
        }
        if (concreteCase.isChained() && !isBlank(concreteCase.getParentCorrelationId())) {
            message.put(tags.getParentReference(), concreteCase.getParentCorrelationId());
        }

        for (Map.Entry<String, String> update : concreteCase.getUpdateMap().entrySet()) {
            String value = placeholderResolver.resolve(update.getValue(), message, registry);
            if (value.isEmpty()) {
                message.remove(update.getKey());
            } else {
                message.put(update.getKey(), value);
            }
        }

        if (isBlank(message.get(tags.getTimestamp()))) {
            message.put(tags.getTimestamp(), LocalDateTime.now(clock).format(timestampFormatter));
        }
        return message;
    }

    private static CaseResult fail(CaseResult result, FailureReason reason, String message) {
        result.setOutcome(Outcome.FAIL);
        result.setFailureReason(reason);
        result.setReasons(List.of(message));
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
