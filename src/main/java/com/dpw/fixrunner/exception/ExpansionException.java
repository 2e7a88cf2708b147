package com.dpw.fixrunner.exception;

/**
 * Thrown when a row's update spec cannot be expanded unambiguously. Fails the row only.
 */
public class ExpansionException extends RuntimeException {

    public ExpansionException(String message) {
        super(message);
    }

    public static ExpansionException multipleAxes(String testCaseId, String firstTag, String secondTag) {
        return new ExpansionException(String.format(
                "Only one multi-valued tag (besides the type tag) allowed in %s: found %s and %s",
                testCaseId, firstTag, secondTag));
    }
}
