package com.dpw.fixrunner.codec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Converts between a delimited {@code tag=value} line and an ordered field map.
 */
public final class TagCodec {

    private TagCodec() {
        // Private constructor to prevent instantiation
    }

    /**
     * Splits {@code text} on {@code delimiter} and each token on its first {@code =}.
     * Tokens without {@code =} are dropped.
     */
    public static Map<String, String> decode(String text, String delimiter) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return fields;
        }
        for (String token : text.split(Pattern.quote(delimiter), -1)) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                continue;
            }
            fields.put(token.substring(0, eq), token.substring(eq + 1));
        }
        return fields;
    }

    public static String encode(Map<String, String> fields, String delimiter) {
        StringJoiner joiner = new StringJoiner(delimiter);
        fields.forEach((tag, value) -> joiner.add(tag + "=" + value));
        return joiner.toString();
    }

    // Re-delimits a line, e.g. a SOH wire record rendered with '|' for reports
    public static String convert(String text, String fromDelimiter, String toDelimiter) {
        if (text == null) {
            return null;
        }
        return text.replace(fromDelimiter, toDelimiter);
    }
}
