package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - rawValue (exactly what the user typed, e.g. "42" or "=SUM(A1:A3)")
 * - formula (same as rawValue when it starts with "=", otherwise null)
 * - valueType (detected from rawValue)
 * - displayFormat (opaque to the engine, passed through)
 * - value / error (the last computed result; at most one of them is set)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Cell {
    public static final String FORMULA_MARKER = "=";

    private String rawValue;
    private String formula;
    private ValueType valueType;
    private String displayFormat;
    private String value;
    private String error;

    public Cell(String rawValue) {
        setRawValue(rawValue);
    }

    public Cell(Cell other) {
        this.rawValue = other.rawValue;
        this.formula = other.formula;
        this.valueType = other.valueType;
        this.displayFormat = other.displayFormat;
        this.value = other.value;
        this.error = other.error;
    }

    public static Cell of(String rawValue) {
        return new Cell(rawValue);
    }

    public String getRawValue() {
        return rawValue;
    }

    /**
     * Replaces the content. Literals take their raw text as value right away;
     * formulas have no value until they are evaluated.
     */
    public void setRawValue(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
        this.valueType = ValueType.detect(this.rawValue);
        this.formula = valueType == ValueType.FORMULA ? this.rawValue : null;
        this.value = formula == null ? this.rawValue : null;
        this.error = null;
    }

    public String getFormula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public String getDisplayFormat() {
        return displayFormat;
    }

    public void setDisplayFormat(String displayFormat) {
        this.displayFormat = displayFormat;
    }

    public String getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    /**
     * Stores an evaluation result, routing error codes to the error field.
     */
    public void applyResult(String result) {
        if (ErrorCode.isError(result)) {
            this.error = result;
            this.value = null;
        } else {
            this.value = result;
            this.error = null;
        }
    }

    /**
     * What a grid would show: the error code if there is one, else the value.
     */
    public String getDisplayValue() {
        if (error != null) {
            return error;
        }
        return value == null ? "" : value;
    }
}
