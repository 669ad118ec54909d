package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a caller asks for a cell that holds no value.
 * For example, "Cell B7 not found in sheet 3".
 */
public class CellNotFoundException extends RuntimeException {
    public CellNotFoundException(String message) {
        super(message);
    }
}
