package com.dpw.fixrunner.validation;

import com.dpw.fixrunner.model.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compares expected tag patterns with the tags of a received message.
 *
 * <p>An empty expected value means the tag must be absent. Any other value is a regular
 * expression that has to match the whole actual value. Every expected tag produces one
 * reason line, passed or not.</p>
 */
@Slf4j
@Component
public class TagValidator {

    public ValidationOutcome validate(Map<String, String> expected, Map<String, String> actual) {
        return validate(expected, actual, new PatternCache());
    }

    public ValidationOutcome validate(Map<String, String> expected, Map<String, String> actual, PatternCache patternCache) {
        PatternCache cache = patternCache != null ? patternCache : new PatternCache();
        boolean passed = true;
        List<String> reasons = new ArrayList<>();

        for (Map.Entry<String, String> entry : expected.entrySet()) {
            String tag = entry.getKey();
            String expectedPattern = entry.getValue();
            String actualValue = actual.get(tag);

            if (expectedPattern.isEmpty()) {
                if (actual.containsKey(tag)) {
                    reasons.add(String.format("FAIL: Tag %s expected deleted but found %s", tag, actualValue));
                    passed = false;
                } else {
                    reasons.add(String.format("PASS: Tag %s correctly deleted", tag));
                }
                continue;
            }

            Pattern pattern;
            try {
                pattern = cache.compile(expectedPattern);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid expected pattern for tag {}: {}", tag, e.getDescription());
                reasons.add(String.format("FAIL: Tag %s has invalid pattern %s: %s", tag, expectedPattern, e.getDescription()));
                passed = false;
                continue;
            }

            if (actualValue == null) {
                reasons.add(String.format("FAIL: Tag %s missing. Pattern: %s", tag, expectedPattern));
                passed = false;
            } else if (!pattern.matcher(actualValue).matches()) {
                reasons.add(String.format("FAIL: Tag %s regex mismatch. Pattern: %s, Actual: %s", tag, expectedPattern, actualValue));
                passed = false;
            } else {
                reasons.add(String.format("PASS: Tag %s regex match successful [%s]", tag, expectedPattern));
            }
        }

        return new ValidationOutcome(passed, reasons);
    }
}
