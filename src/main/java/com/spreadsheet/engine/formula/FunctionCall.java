package com.spreadsheet.engine.formula;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed {@code NAME(arg1, arg2, ...)} expression. Arguments are kept as raw,
 * unresolved strings; each function decides how to resolve them.
 */
public final class FunctionCall {

    private static final Pattern CALL_START = Pattern.compile("^([A-Z][A-Z0-9]*)\\(");

    private final String name;
    private final List<String> arguments;

    public FunctionCall(String name, List<String> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    /**
     * Recognizes an expression that is exactly one call: the parenthesis
     * opened after the name must close at the very end.
     * "SUM(A1:A3)" is a call, "SUM(A1)+SUM(A2)" is not.
     */
    public static Optional<FunctionCall> parse(String expression) {
        String text = expression.trim();
        Matcher matcher = CALL_START.matcher(text);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        int open = matcher.end() - 1;
        int close = FormulaTokenizer.findClosingParenthesis(text, open);
        if (close != text.length() - 1) {
            return Optional.empty();
        }
        List<String> arguments = FormulaTokenizer.splitArguments(text.substring(open + 1, close));
        return Optional.of(new FunctionCall(matcher.group(1), arguments));
    }

    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", arguments) + ")";
    }
}
