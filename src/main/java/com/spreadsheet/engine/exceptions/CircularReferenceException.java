package com.spreadsheet.engine.exceptions;

/**
 * Thrown while resolving a cell reference that leads back to a formula
 * already being evaluated (e.g., a cell referencing itself, or a multi-cell loop).
 * Never escapes the evaluator: it is reported in-band as "#CIRCULAR!".
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
