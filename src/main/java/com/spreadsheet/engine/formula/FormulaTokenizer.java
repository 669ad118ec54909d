package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaEvaluationException;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers over formula bodies: reference extraction,
 * argument splitting and string-literal handling.
 */
public final class FormulaTokenizer {

    private static final Pattern CELL_REFERENCE = Pattern.compile("\\b[A-Z]+\\d+\\b");
    private static final Pattern RANGE_REFERENCE = Pattern.compile("\\b[A-Z]+\\d+:[A-Z]+\\d+\\b");

    private FormulaTokenizer() {
    }

    /**
     * Finds every cell a formula body reads. Ranges are expanded, so "A1:A3"
     * contributes A1, A2 and A3 individually. Text inside string literals is ignored.
     *
     * @throws com.spreadsheet.engine.exceptions.InvalidAddressException for references such as "A0"
     * @throws FormulaEvaluationException if a range holds more than maxRangeCells cells
     */
    public static Set<String> extractReferences(String formulaBody, long maxRangeCells) {
        String text = stripStringLiterals(formulaBody);
        Set<String> references = new LinkedHashSet<>();

        Matcher cellMatcher = CELL_REFERENCE.matcher(text);
        while (cellMatcher.find()) {
            references.add(CellAddress.decode(cellMatcher.group()).toString());
        }

        Matcher rangeMatcher = RANGE_REFERENCE.matcher(text);
        while (rangeMatcher.find()) {
            references.addAll(expandRange(rangeMatcher.group(), maxRangeCells));
        }
        return references;
    }

    public static Set<String> extractReferences(String formulaBody) {
        return extractReferences(formulaBody, Long.MAX_VALUE);
    }

    /**
     * Parses a range and lists its cells, refusing ranges larger than maxRangeCells.
     */
    public static List<String> expandRange(String range, long maxRangeCells) {
        CellRange cellRange = CellRange.parse(range);
        if (cellRange.size() > maxRangeCells) {
            throw new FormulaEvaluationException("Range " + cellRange + " has " + cellRange.size()
                    + " cells, the limit is " + maxRangeCells);
        }
        return cellRange.cells();
    }

    /**
     * Splits the text between a call's parentheses on top-level commas,
     * e.g. {@code IF(A1>0,B1,0), "x,y", C1} -> [IF(A1>0,B1,0), "x,y", C1].
     * A quote preceded by a backslash does not open or close a literal.
     */
    public static List<String> splitArguments(String callBody) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < callBody.length(); i++) {
            char c = callBody.charAt(i);
            if (isQuoteChar(c) && !isEscaped(callBody, i)) {
                if (quote == 0) {
                    quote = c;
                } else if (quote == c) {
                    quote = 0;
                }
            }
            if (quote == 0) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    arguments.add(current.toString().trim());
                    current.setLength(0);
                    continue;
                }
            }
            current.append(c);
        }

        if (!current.toString().trim().isEmpty()) {
            arguments.add(current.toString().trim());
        }
        return arguments;
    }

    /**
     * Index of the parenthesis closing the one at openIndex, or -1 if unbalanced.
     */
    public static int findClosingParenthesis(String text, int openIndex) {
        int depth = 0;
        char quote = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isQuoteChar(c) && !isEscaped(text, i)) {
                if (quote == 0) {
                    quote = c;
                } else if (quote == c) {
                    quote = 0;
                }
                continue;
            }
            if (quote != 0) {
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Replaces every string literal, quotes included, with spaces.
     * Offsets into the result line up with the input.
     */
    public static String stripStringLiterals(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isQuoteChar(c) && !isEscaped(text, i) && (quote == 0 || quote == c)) {
                quote = quote == 0 ? c : 0;
                out.append(' ');
            } else {
                out.append(quote == 0 ? c : ' ');
            }
        }
        return out.toString();
    }

    /**
     * Like {@link #stripStringLiterals(String)}, but also blanks out everything
     * nested inside parentheses, leaving only top-level text.
     */
    public static String maskNested(String text) {
        String stripped = stripStringLiterals(text);
        StringBuilder out = new StringBuilder(stripped.length());
        int depth = 0;
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (c == '(') {
                depth++;
                out.append(' ');
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                out.append(' ');
            } else {
                out.append(depth == 0 ? c : ' ');
            }
        }
        return out.toString();
    }

    public static boolean isQuoted(String text) {
        if (text.length() < 2) {
            return false;
        }
        char first = text.charAt(0);
        return isQuoteChar(first) && text.charAt(text.length() - 1) == first;
    }

    /**
     * Removes the surrounding quotes of a literal and resolves escaped quotes.
     */
    public static String unquote(String text) {
        if (!isQuoted(text)) {
            return text;
        }
        char quote = text.charAt(0);
        return text.substring(1, text.length() - 1).replace("\\" + quote, String.valueOf(quote));
    }

    private static boolean isQuoteChar(char c) {
        return c == '"' || c == '\'';
    }

    private static boolean isEscaped(String text, int index) {
        return index > 0 && text.charAt(index - 1) == '\\';
    }
}
