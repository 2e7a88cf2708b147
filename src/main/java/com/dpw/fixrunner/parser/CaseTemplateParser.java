package com.dpw.fixrunner.parser;

import com.dpw.fixrunner.model.CaseTemplate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads case templates from a CSV file with a header row.
 *
 * <p>Columns: {@code UseCaseID, TestCaseID, BaseMessage, TagsToUpdate, TagsToValidate} and
 * the optional {@code ExpectedValidationResult}.</p>
 */
@Slf4j
@Component
public class CaseTemplateParser {

    public static final String USE_CASE_ID = "UseCaseID";
    public static final String TEST_CASE_ID = "TestCaseID";
    public static final String BASE_MESSAGE = "BaseMessage";
    public static final String TAGS_TO_UPDATE = "TagsToUpdate";
    public static final String TAGS_TO_VALIDATE = "TagsToValidate";
    public static final String EXPECTED_VALIDATION_RESULT = "ExpectedValidationResult";

    private static final Set<String> NEGATIVE_VALUES = Set.of("false", "fail", "no", "0", "n");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    public List<CaseTemplate> parse(Path csvFile) throws IOException {
        log.info("Execution started with Input File: {}", csvFile);
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public List<CaseTemplate> parseInline(String csv) throws IOException {
        return parse(new StringReader(csv));
    }

    public List<CaseTemplate> parse(Reader reader) throws IOException {
        List<CaseTemplate> templates = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                int rowNumber = (int) record.getRecordNumber();
                String testCaseId = column(record, TEST_CASE_ID);
                if (testCaseId.isEmpty()) {
                    log.warn("Skipping row {}: no {}", rowNumber, TEST_CASE_ID);
                    continue;
                }
                templates.add(CaseTemplate.builder()
                        .rowNumber(rowNumber)
                        .useCaseId(column(record, USE_CASE_ID))
                        .testCaseId(testCaseId)
                        .baseMessage(column(record, BASE_MESSAGE))
                        .updateSpec(column(record, TAGS_TO_UPDATE))
                        .validateSpec(column(record, TAGS_TO_VALIDATE))
                        .expectedOutcome(parseExpectedOutcome(column(record, EXPECTED_VALIDATION_RESULT)))
                        .build());
            }
        }
        log.info("Loaded {} case template(s)", templates.size());
        return templates;
    }

    /**
     * Blank means the case is expected to pass validation.
     */
    static boolean parseExpectedOutcome(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return !NEGATIVE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return "";
        }
        String value = record.get(name);
        return value == null ? "" : value;
    }
}
