package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaEvaluationException;

import java.util.function.DoubleSupplier;

/**
 * Recursive-descent evaluator for plain arithmetic over numbers:
 * {@code + - * /}, unary signs and parentheses.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := ('+' | '-') factor | number | '(' expression ')'
 * </pre>
 */
public final class ArithmeticParser {

    private static final int DEFAULT_MAX_NESTING = 512;

    private final String input;
    private final int maxNesting;
    private int position;
    private int nesting;

    private ArithmeticParser(String input, int maxNesting) {
        this.input = input;
        this.maxNesting = maxNesting;
    }

    public static double evaluate(String expression) {
        return evaluate(expression, DEFAULT_MAX_NESTING);
    }

    /**
     * Evaluates the expression, refusing parentheses and unary signs nested
     * deeper than maxNesting.
     */
    public static double evaluate(String expression, int maxNesting) {
        ArithmeticParser parser = new ArithmeticParser(expression, maxNesting);
        double result = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.position < parser.input.length()) {
            throw parser.error("Unexpected '" + parser.input.charAt(parser.position) + "'");
        }
        return result;
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseFactor();
        while (true) {
            if (consume('*')) {
                value *= parseFactor();
            } else if (consume('/')) {
                value /= parseFactor();
            } else {
                return value;
            }
        }
    }

    private double parseFactor() {
        if (consume('+')) {
            return nested(this::parseFactor);
        }
        if (consume('-')) {
            return -nested(this::parseFactor);
        }
        if (consume('(')) {
            double value = nested(this::parseExpression);
            if (!consume(')')) {
                throw error("Missing ')'");
            }
            return value;
        }
        return parseNumber();
    }

    private double nested(DoubleSupplier inner) {
        if (++nesting > maxNesting) {
            throw error("Expression nested deeper than " + maxNesting + " levels");
        }
        double value = inner.getAsDouble();
        nesting--;
        return value;
    }

    private double parseNumber() {
        skipWhitespace();
        int start = position;
        while (position < input.length()
                && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
            position++;
        }
        if (start == position) {
            throw error(position < input.length() ? "Unexpected '" + input.charAt(position) + "'" : "Unexpected end");
        }
        String token = input.substring(start, position);
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new FormulaEvaluationException("Malformed number '" + token + "' in: " + input, e);
        }
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (position < input.length() && input.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (position < input.length() && input.charAt(position) == ' ') {
            position++;
        }
    }

    private FormulaEvaluationException error(String message) {
        return new FormulaEvaluationException(message + " at position " + position + " in: " + input);
    }
}
