package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaEvaluationException;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reading and printing of numeric cell values.
 */
public final class Numbers {

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NUMERIC_LITERAL =
            Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?\\s*$");

    private Numbers() {
    }

    /**
     * Reads the number a value starts with ("12abc" -> 12), or null if it has none.
     */
    public static Double parse(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.lookingAt()) {
            return null;
        }
        return Double.parseDouble(matcher.group().trim());
    }

    public static boolean isNumericLiteral(String value) {
        return value != null && NUMERIC_LITERAL.matcher(value).matches();
    }

    /**
     * Integral values print without a fraction ("15", not "15.0").
     */
    public static String format(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new FormulaEvaluationException("Result is not a finite number");
        }
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * "true" in any case, or anything that reads as a nonzero number.
     */
    public static boolean isTruthy(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        Double number = parse(value);
        return number != null && number != 0;
    }
}
