package com.spreadsheet.engine.formula.functions;

import com.spreadsheet.engine.formula.CellValueResolver;
import com.spreadsheet.engine.formula.Numbers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Base for functions folding numbers gathered from their arguments.
 * Each argument is a range, a cell reference, a literal or a nested
 * expression; values that do not read as numbers are skipped.
 */
public abstract class AggregateFunction implements FormulaFunction {

    private static final Pattern RANGE_PATTERN = Pattern.compile("^[A-Z]+\\d+:[A-Z]+\\d+$");

    @Override
    public String apply(List<String> arguments, CellValueResolver resolver) {
        List<Double> numbers = new ArrayList<>();
        for (String argument : arguments) {
            if (RANGE_PATTERN.matcher(argument).matches()) {
                for (String address : resolver.expandRange(argument)) {
                    addIfNumeric(numbers, resolver.resolveCell(address));
                }
            } else {
                addIfNumeric(numbers, resolver.resolveValue(argument));
            }
        }
        return Numbers.format(aggregate(numbers));
    }

    protected abstract double aggregate(List<Double> numbers);

    private static void addIfNumeric(List<Double> numbers, String value) {
        Double number = Numbers.parse(value);
        if (number != null) {
            numbers.add(number);
        }
    }
}
