package com.spreadsheet.engine.exceptions;

/**
 * Thrown for any evaluation failure other than a circular reference:
 * malformed arguments, a rejected arithmetic expression, an oversized range, etc.
 * Reported in-band as "#ERROR!".
 */
public class FormulaEvaluationException extends RuntimeException {
    public FormulaEvaluationException(String message) {
        super(message);
    }

    public FormulaEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
