package com.dpw.fixrunner.validation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Compiled expected-value patterns shared by all cases expanded from one template.
 */
public class PatternCache {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * @throws java.util.regex.PatternSyntaxException if {@code regex} is not a valid pattern
     */
    public Pattern compile(String regex) {
        return patterns.computeIfAbsent(regex, Pattern::compile);
    }

    int size() {
        return patterns.size();
    }
}
