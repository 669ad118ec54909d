package com.spreadsheet.engine.formula.functions;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Counts arguments holding a nonzero number. Blank cells read as 0,
 * so this counts meaningful entries rather than non-blank cells.
 */
@Component
public class CountFunction extends AggregateFunction {

    @Override
    public String getName() {
        return "COUNT";
    }

    @Override
    protected double aggregate(List<Double> numbers) {
        int count = 0;
        for (double number : numbers) {
            if (number != 0) {
                count++;
            }
        }
        return count;
    }
}
