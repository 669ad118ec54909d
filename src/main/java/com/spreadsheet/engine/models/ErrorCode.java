package com.spreadsheet.engine.models;

/**
 * Error values a formula can evaluate to. They are returned as cell values,
 * never thrown to the caller.
 */
public enum ErrorCode {
    CIRCULAR("#CIRCULAR!"),
    ERROR("#ERROR!");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Returns the matching error, or null if the value is an ordinary result.
     */
    public static ErrorCode fromValue(String value) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(value)) {
                return errorCode;
            }
        }
        return null;
    }

    public static boolean isError(String value) {
        return fromValue(value) != null;
    }

    @Override
    public String toString() {
        return code;
    }
}
