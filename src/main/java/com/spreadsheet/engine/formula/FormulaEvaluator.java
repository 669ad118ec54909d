package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.exceptions.FormulaEvaluationException;
import com.spreadsheet.engine.formula.functions.FormulaFunction;
import com.spreadsheet.engine.formula.functions.FunctionRegistry;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates formula strings against a cell table, resolving referenced
 * cells on demand. Circular references and compute failures come back as
 * "#CIRCULAR!" and "#ERROR!" values; nothing is thrown to the caller.
 */
@Component
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private static final String EMPTY_VALUE = "0";
    private static final Pattern REFERENCE_TOKEN = Pattern.compile("\\b[A-Z]+\\d+\\b");
    // Only these characters may remain once references are substituted
    private static final Pattern ARITHMETIC_WHITELIST = Pattern.compile("^[\\d+\\-*/.() ]+$");
    private static final Pattern ARITHMETIC_SHAPE = Pattern.compile("^[A-Z0-9+\\-*/.() ]+$");

    private final FunctionRegistry functions;
    private final EngineProperties properties;

    public FormulaEvaluator(FunctionRegistry functions, EngineProperties properties) {
        this.functions = functions;
        this.properties = properties;
    }

    /**
     * Evaluates one formula (with or without the leading "=") as the content of cellId.
     */
    public String evaluate(String formula, String cellId, Map<String, Cell> cells) {
        EvaluationContext context = new EvaluationContext(cells, this,
                properties.getMaxRangeCells(), properties.getMaxDepth(), properties.getMaxNesting());
        String result = evaluate(formula, cellId, context);
        if (!context.isIdle()) {
            throw new IllegalStateException("Evaluation of " + cellId + " left cells marked in progress");
        }
        return result;
    }

    String evaluate(String formula, String cellId, EvaluationContext context) {
        if (context.isInProgress(cellId)) {
            return ErrorCode.CIRCULAR.getCode();
        }
        try {
            context.begin(cellId);
            String expression = formula.startsWith(Cell.FORMULA_MARKER) ? formula.substring(1) : formula;
            context.checkReferences(expression);
            return evaluateExpression(expression, context);
        } catch (CircularReferenceException e) {
            log.debug("Circular reference while evaluating {}: {}", cellId, e.getMessage());
            return ErrorCode.CIRCULAR.getCode();
        } catch (RuntimeException e) {
            log.debug("Evaluation of {} failed: {}", cellId, e.getMessage());
            return ErrorCode.ERROR.getCode();
        } finally {
            context.end(cellId);
        }
    }

    /**
     * Dispatches an expression (no leading "=") to a registered function,
     * a bare cell reference, or the arithmetic evaluator.
     */
    String evaluateExpression(String expression, EvaluationContext context) {
        try {
            context.enterExpression();
            String expr = expression.trim();

            Optional<FunctionCall> call = FunctionCall.parse(expr);
            if (call.isPresent()) {
                Optional<FormulaFunction> function = functions.find(call.get().getName());
                if (function.isPresent()) {
                    return function.get().apply(call.get().getArguments(), context);
                }
            }

            if (CellAddress.isAddress(expr)) {
                return resolveCell(expr, context);
            }

            return evaluateArithmetic(expr, context);
        } finally {
            context.exitExpression();
        }
    }

    String resolveCell(String address, EvaluationContext context) {
        CellAddress.decode(address);
        Cell cell = context.getCell(address);
        if (cell == null) {
            return EMPTY_VALUE;
        }
        if (cell.hasFormula()) {
            if (context.isInProgress(address)) {
                throw new CircularReferenceException("Cycle detected at " + address);
            }
            return raiseIfError(evaluate(cell.getFormula(), address, context), address);
        }
        String value = cell.getValue();
        return value == null || value.isEmpty() ? EMPTY_VALUE : value;
    }

    String resolveValue(String argument, EvaluationContext context) {
        String arg = argument.trim();
        if (FormulaTokenizer.isQuoted(arg)) {
            return FormulaTokenizer.unquote(arg);
        }
        if (CellAddress.isAddress(arg)) {
            return resolveCell(arg, context);
        }
        if (Numbers.isNumericLiteral(arg)) {
            return arg;
        }
        if (arg.indexOf(':') >= 0) {
            // throws InvalidAddressException for "A1:B", "A1:B2:C3" and the like
            CellRange.parse(arg);
        }
        if (FunctionCall.parse(arg).isPresent() || isArithmetic(arg)) {
            return raiseIfError(evaluateExpression(arg, context), arg);
        }
        return arg;
    }

    /**
     * Substitutes referenced cells with their numeric values (non-numbers read as 0),
     * then evaluates the result if only digits, operators, dots, parentheses
     * and spaces are left.
     */
    private String evaluateArithmetic(String expr, EvaluationContext context) {
        Matcher matcher = REFERENCE_TOKEN.matcher(expr);
        StringBuilder substituted = new StringBuilder();
        while (matcher.find()) {
            Double number = Numbers.parse(resolveCell(matcher.group(), context));
            String replacement = Numbers.format(number == null ? 0 : number);
            matcher.appendReplacement(substituted, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(substituted);

        String arithmetic = substituted.toString();
        if (!ARITHMETIC_WHITELIST.matcher(arithmetic).matches()) {
            throw new FormulaEvaluationException("Unsupported expression: " + expr);
        }
        return Numbers.format(ArithmeticParser.evaluate(arithmetic, context.getMaxNesting()));
    }

    private static boolean isArithmetic(String text) {
        if (!ARITHMETIC_SHAPE.matcher(text).matches()) {
            return false;
        }
        for (char c : text.toCharArray()) {
            if ("+-*/()".indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String raiseIfError(String value, String source) {
        ErrorCode errorCode = ErrorCode.fromValue(value);
        if (errorCode == ErrorCode.CIRCULAR) {
            throw new CircularReferenceException("Circular reference reached through " + source);
        }
        if (errorCode == ErrorCode.ERROR) {
            throw new FormulaEvaluationException("Error value in " + source);
        }
        return value;
    }
}
