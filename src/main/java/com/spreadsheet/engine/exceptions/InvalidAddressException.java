package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a cell address or range string is malformed,
 * e.g. "1A", "A0" or "A1:B".
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }

    public InvalidAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
