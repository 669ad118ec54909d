package com.spreadsheet.engine.formula.functions;

import com.spreadsheet.engine.formula.CellValueResolver;
import com.spreadsheet.engine.formula.FormulaTokenizer;
import com.spreadsheet.engine.formula.Numbers;
import com.spreadsheet.engine.models.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * IF(condition, valueIfTrue, valueIfFalse). Only the chosen branch is resolved.
 */
@Component
public class IfFunction implements FormulaFunction {

    // Two-character operators first, so ">=" is not read as ">"
    private static final String[] OPERATORS = {">=", "<=", "!=", "<>", "=", ">", "<"};

    @Override
    public String getName() {
        return "IF";
    }

    @Override
    public String apply(List<String> arguments, CellValueResolver resolver) {
        if (arguments.size() != 3) {
            return ErrorCode.ERROR.getCode();
        }
        boolean condition = evaluateCondition(arguments.get(0), resolver);
        return resolver.resolveValue(condition ? arguments.get(1) : arguments.get(2));
    }

    /**
     * Compares numerically when both sides read as numbers, otherwise only
     * equality and inequality are defined for text; ordering text yields false.
     * Without an operator, the condition holds for "true" or a nonzero number.
     */
    boolean evaluateCondition(String condition, CellValueResolver resolver) {
        String topLevel = FormulaTokenizer.maskNested(condition);
        for (String operator : OPERATORS) {
            int index = topLevel.indexOf(operator);
            if (index < 0) {
                continue;
            }
            String left = resolver.resolveValue(condition.substring(0, index).trim());
            String right = resolver.resolveValue(condition.substring(index + operator.length()).trim());
            return compare(left, operator, right);
        }
        return Numbers.isTruthy(resolver.resolveValue(condition.trim()));
    }

    private static boolean compare(String left, String operator, String right) {
        Double leftNumber = Numbers.parse(left);
        Double rightNumber = Numbers.parse(right);
        if (leftNumber != null && rightNumber != null) {
            double l = leftNumber;
            double r = rightNumber;
            switch (operator) {
                case ">=":
                    return l >= r;
                case "<=":
                    return l <= r;
                case "!=":
                case "<>":
                    return l != r;
                case "=":
                    return l == r;
                case ">":
                    return l > r;
                case "<":
                    return l < r;
                default:
                    return false;
            }
        }
        switch (operator) {
            case "!=":
            case "<>":
                return !left.equals(right);
            case "=":
                return left.equals(right);
            default:
                return false;
        }
    }
}
