package com.dpw.fixrunner.resolver;

import com.dpw.fixrunner.exception.PlaceholderResolutionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What was actually sent for each test case of a run, in execution order.
 * Entries are written once and never replaced, so a case can only see cases that ran
 * before it.
 */
@Slf4j
public class ResolvedRegistry {

    private final Map<String, Map<String, String>> sentMessages = new LinkedHashMap<>();

    /**
     * @return {@code false} if the test case was already registered; the first entry is kept
     */
    public synchronized boolean register(String testCaseId, Map<String, String> sentFields) {
        if (sentMessages.containsKey(testCaseId)) {
            log.warn("Test case {} already registered; keeping the first sent message", testCaseId);
            return false;
        }
        sentMessages.put(testCaseId, Collections.unmodifiableMap(new LinkedHashMap<>(sentFields)));
        return true;
    }

    synchronized Optional<Map<String, String>> find(String testCaseId) {
        return Optional.ofNullable(sentMessages.get(testCaseId));
    }

    /**
     * Looks up the referenced field of an executed test case.
     *
     * @throws PlaceholderResolutionException if the case has not run yet or did not send the tag
     */
    public synchronized String lookup(String token, String testCaseId, String tag) {
        Map<String, String> fields = sentMessages.get(testCaseId);
        if (fields == null) {
            throw PlaceholderResolutionException.notYetExecuted(token, testCaseId);
        }
        String value = fields.get(tag);
        if (value == null) {
            throw PlaceholderResolutionException.unknownReferencedTag(token, testCaseId, tag);
        }
        return value;
    }

    synchronized int size() {
        return sentMessages.size();
    }
}
