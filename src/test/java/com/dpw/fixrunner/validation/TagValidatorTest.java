package com.dpw.fixrunner.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.dpw.fixrunner.model.ValidationOutcome;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TagValidatorTest {

    private final TagValidator validator = new TagValidator();

    @Test
    void passesWhenEveryPatternMatchesTheWholeValue() {
        ValidationOutcome outcome = validator.validate(
                ordered("39", "0", "150", "[0-9A-Z]"),
                Map.of("39", "0", "150", "F"));

        assertThat(outcome.isPassed()).isTrue();
        assertThat(outcome.getReasons()).containsExactly(
                "PASS: Tag 39 regex match successful [0]",
                "PASS: Tag 150 regex match successful [[0-9A-Z]]");
    }

    @Test
    void substringMatchIsNotEnough() {
        ValidationOutcome outcome = validator.validate(Map.of("39", "0"), Map.of("39", "10"));

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getReasons()).containsExactly("FAIL: Tag 39 regex mismatch. Pattern: 0, Actual: 10");
    }

    @Test
    void missingTagFails() {
        ValidationOutcome outcome = validator.validate(Map.of("37", ".+"), Map.of());

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getReasons()).containsExactly("FAIL: Tag 37 missing. Pattern: .+");
    }

    @Test
    void emptyExpectationRequiresAbsence() {
        assertThat(validator.validate(Map.of("58", ""), Map.of()).getReasons())
                .containsExactly("PASS: Tag 58 correctly deleted");

        ValidationOutcome present = validator.validate(Map.of("58", ""), Map.of("58", "text"));
        assertThat(present.isPassed()).isFalse();
        assertThat(present.getReasons()).containsExactly("FAIL: Tag 58 expected deleted but found text");
    }

    @Test
    void everyTagIsReportedEvenAfterAFailure() {
        ValidationOutcome outcome = validator.validate(
                ordered("39", "8", "150", "F"),
                Map.of("39", "0", "150", "F"));

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getReasons()).hasSize(2);
        assertThat(outcome.getReasons().get(1)).startsWith("PASS: Tag 150");
    }

    @Test
    void invalidPatternFailsTheTag() {
        ValidationOutcome outcome = validator.validate(Map.of("39", "[0"), Map.of("39", "0"));

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getReasons().get(0)).startsWith("FAIL: Tag 39 has invalid pattern [0");
    }

    @Test
    void emptyExpectationPasses() {
        ValidationOutcome outcome = validator.validate(Map.of(), Map.of("39", "0"));

        assertThat(outcome.isPassed()).isTrue();
        assertThat(outcome.getReasons()).isEmpty();
    }

    @Test
    void patternCacheCompilesEachPatternOnce() {
        PatternCache cache = new PatternCache();

        validator.validate(Map.of("39", "0|2"), Map.of("39", "0"), cache);
        validator.validate(Map.of("39", "0|2"), Map.of("39", "2"), cache);

        assertThat(cache.size()).isEqualTo(1);
    }

    private static Map<String, String> ordered(String... tagValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < tagValues.length; i += 2) {
            map.put(tagValues[i], tagValues[i + 1]);
        }
        return map;
    }
}
