package com.dpw.fixrunner.resolver;

import com.dpw.fixrunner.exception.PlaceholderResolutionException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${tag}} with a field of the local message and
 * {@code ${testCaseId.tag}} with a field sent by an earlier test case.
 */
@Component
public class PlaceholderResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    public String resolve(String text, Map<String, String> localFields, ResolvedRegistry registry) {
        if (text == null || !text.contains("${")) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group(1);
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(lookup(token, localFields, registry)));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    public Map<String, String> resolveAll(Map<String, String> fields, Map<String, String> localFields, ResolvedRegistry registry) {
        Map<String, String> resolved = new LinkedHashMap<>();
        fields.forEach((tag, value) -> resolved.put(tag, resolve(value, localFields, registry)));
        return resolved;
    }

    private String lookup(String token, Map<String, String> localFields, ResolvedRegistry registry) {
        // test case ids may contain dots, tags never do
        int dot = token.lastIndexOf('.');
        if (dot < 0) {
            String value = localFields.get(token);
            if (value == null) {
                throw PlaceholderResolutionException.unknownLocalTag(token);
            }
            return value;
        }
        if (registry == null) {
            throw PlaceholderResolutionException.notYetExecuted(token, token.substring(0, dot));
        }
        return registry.lookup(token, token.substring(0, dot), token.substring(dot + 1));
    }
}
