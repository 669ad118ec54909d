package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Enumerates the kinds of content a cell can hold:
 * TEXT, NUMBER, BOOLEAN, DATE, FORMULA.
 */
public enum ValueType {
    TEXT,
    NUMBER,
    BOOLEAN,
    DATE,
    FORMULA;

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?\\s*$");
    private static final Pattern SLASH_DATE_PATTERN = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    /**
     * Guesses the type of a raw value as typed by the user.
     */
    public static ValueType detect(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return TEXT;
        }
        if (rawValue.startsWith("=")) {
            return FORMULA;
        }
        if ("true".equalsIgnoreCase(rawValue) || "false".equalsIgnoreCase(rawValue)) {
            return BOOLEAN;
        }
        if (NUMBER_PATTERN.matcher(rawValue).matches()) {
            return NUMBER;
        }
        if (SLASH_DATE_PATTERN.matcher(rawValue).matches() || ISO_DATE_PATTERN.matcher(rawValue).matches()) {
            return DATE;
        }
        return TEXT;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Allows case-insensitive JSON input.
     * For example, "number" -> NUMBER, "Formula" -> FORMULA.
     */
    @JsonCreator
    public static ValueType fromValue(String value) {
        return ValueType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
