package com.dpw.fixrunner.generator;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.ExpansionException;
import com.dpw.fixrunner.model.CaseTemplate;
import com.dpw.fixrunner.model.ConcreteCase;
import com.dpw.fixrunner.utils.JsonUtils;
import com.dpw.fixrunner.validation.PatternCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one {@link CaseTemplate} into the ordered list of cases it describes.
 *
 * <p>Update spec grammar, fields separated by the field delimiter:</p>
 * <ul>
 *   <li>{@code tag=value} sets a tag, an empty value deletes it from the base message</li>
 *   <li>{@code [t1~t2]=value} is shorthand for {@code t1=value|t2=value}</li>
 *   <li>{@code tag=A~B~C} on a non-type tag is the axis: one case per value</li>
 *   <li>{@code 35=D~F} sends a {@code D} case followed by a chained {@code F} case whose
 *       parent reference tag carries the {@code D} case's identifier</li>
 * </ul>
 * Validation values pair positionally with the axis, clamped to the last listed value.
 */
@Slf4j
@Component
public class CaseExpansionEngine {

    private final FixRunnerProperties properties;
    private final CorrelationIdGenerator correlationIdGenerator;
    private final Pattern groupPattern;

    public CaseExpansionEngine(FixRunnerProperties properties, CorrelationIdGenerator correlationIdGenerator) {
        this.properties = properties;
        this.correlationIdGenerator = correlationIdGenerator;
        this.groupPattern = Pattern.compile("\\[([^\\]]+)\\]=([^" + Pattern.quote(properties.getFieldDelimiter()) + "]*)");
    }

    public List<ConcreteCase> expand(CaseTemplate template) {
        String testCaseId = template.getTestCaseId();
        String typeTag = properties.getTags().getType();
        String identifierTag = properties.getTags().getIdentifier();
        String parentTag = properties.getTags().getParentReference();

        String updateSpec = expandGroups(nullToEmpty(template.getUpdateSpec()));
        String validateSpec = expandGroups(nullToEmpty(template.getValidateSpec()));

        Map<String, String> fixedUpdates = new LinkedHashMap<>();
        String axisTag = null;
        List<String> axisValues = List.of();
        List<String> typeValues = null;

        for (String[] field : splitFields(updateSpec)) {
            String tag = field[0];
            String value = field[1];
            if (value.contains(properties.getMultiValueDelimiter())) {
                List<String> values = splitValues(value);
                if (tag.equals(typeTag)) {
                    typeValues = values;
                    fixedUpdates.put(tag, values.get(0));
                    continue;
                }
                if (axisTag != null && !axisTag.equals(tag)) {
                    throw ExpansionException.multipleAxes(testCaseId, axisTag, tag);
                }
                axisTag = tag;
                axisValues = values;
                fixedUpdates.put(tag, values.get(0));
            } else {
                if (tag.equals(axisTag)) {
                    axisTag = null;
                    axisValues = List.of();
                }
                if (tag.equals(typeTag)) {
                    typeValues = null;
                }
                fixedUpdates.put(tag, value);
            }
        }

        Map<String, List<String>> validateValues = new LinkedHashMap<>();
        for (String[] field : splitFields(validateSpec)) {
            validateValues.put(field[0], splitValues(field[1]));
        }

        String pinnedIdentifier = fixedUpdates.get(identifierTag);
        boolean pinned = pinnedIdentifier != null && !pinnedIdentifier.isEmpty() && !identifierTag.equals(axisTag);
        int primaryCount = axisTag == null ? 1 : axisValues.size();
        if (pinned && primaryCount > 1) {
            log.warn("Test case {} pins tag {}={} across {} axis values; replies may not be distinguishable",
                    testCaseId, identifierTag, pinnedIdentifier, primaryCount);
        }

        PatternCache patternCache = new PatternCache();
        List<ConcreteCase> cases = new ArrayList<>();

        for (int i = 0; i < primaryCount; i++) {
            Map<String, String> update = new LinkedHashMap<>(fixedUpdates);
            if (axisTag != null) {
                update.put(axisTag, axisValues.get(i));
            }

            String primaryId = primaryCount == 1 ? testCaseId : testCaseId + "-" + (i + 1);
            String correlationId;
            if (identifierTag.equals(axisTag)) {
                correlationId = axisValues.get(i);
            } else {
                correlationId = pinned ? pinnedIdentifier : correlationIdGenerator.next(testCaseId);
            }
            update.put(identifierTag, correlationId);

            Map<String, String> validate = pickValidation(validateValues, i);

            cases.add(ConcreteCase.builder()
                    .useCaseId(template.getUseCaseId())
                    .testCaseId(primaryId)
                    .sourceTestCaseId(testCaseId)
                    .baseMessage(template.getBaseMessage())
                    .updateMap(Collections.unmodifiableMap(update))
                    .validateMap(Collections.unmodifiableMap(validate))
                    .expectedOutcome(template.isExpectedOutcome())
                    .correlationId(correlationId)
                    .chained(false)
                    .patternCache(patternCache)
                    .build());

            if (typeValues == null) {
                continue;
            }
            for (String secondaryType : typeValues.subList(1, typeValues.size())) {
                Map<String, String> secondaryUpdate = new LinkedHashMap<>(update);
                String secondaryId = correlationIdGenerator.next(testCaseId);
                secondaryUpdate.put(typeTag, secondaryType);
                secondaryUpdate.put(identifierTag, secondaryId);
                secondaryUpdate.put(parentTag, correlationId);

                cases.add(ConcreteCase.builder()
                        .useCaseId(template.getUseCaseId())
                        .testCaseId(primaryId + "-" + secondaryType)
                        .sourceTestCaseId(testCaseId)
                        .baseMessage(template.getBaseMessage())
                        .updateMap(Collections.unmodifiableMap(secondaryUpdate))
                        .validateMap(Collections.unmodifiableMap(new LinkedHashMap<>(validate)))
                        .expectedOutcome(template.isExpectedOutcome())
                        .correlationId(secondaryId)
                        .chained(true)
                        .parentCorrelationId(correlationId)
                        .patternCache(patternCache)
                        .build());
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Expanded test cases: {}", JsonUtils.toJsonString(cases));
        }
        log.info("Row {} ({}) expanded into {} case(s)", template.getRowNumber(), testCaseId, cases.size());
        return cases;
    }

    /**
     * Rewrites every {@code [t1~t2]=value} group into {@code t1=value|t2=value}.
     */
    String expandGroups(String spec) {
        Matcher matcher = groupPattern.matcher(spec);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String value = matcher.group(2);
            StringJoiner joiner = new StringJoiner(properties.getFieldDelimiter());
            for (String tag : matcher.group(1).split(Pattern.quote(properties.getMultiValueDelimiter()))) {
                joiner.add(tag.trim() + "=" + value);
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(joiner.toString()));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    private List<String[]> splitFields(String spec) {
        List<String[]> fields = new ArrayList<>();
        for (String token : spec.split(Pattern.quote(properties.getFieldDelimiter()), -1)) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                if (!token.isBlank()) {
                    log.debug("Dropping malformed token '{}'", token);
                }
                continue;
            }
            fields.add(new String[]{token.substring(0, eq).trim(), token.substring(eq + 1)});
        }
        return fields;
    }

    private List<String> splitValues(String value) {
        return Arrays.asList(value.split(Pattern.quote(properties.getMultiValueDelimiter()), -1));
    }

    private static Map<String, String> pickValidation(Map<String, List<String>> validateValues, int index) {
        Map<String, String> validate = new LinkedHashMap<>();
        validateValues.forEach((tag, values) -> validate.put(tag, values.get(Math.min(index, values.size() - 1))));
        return validate;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
