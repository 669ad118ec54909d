package com.spreadsheet.engine.formula.functions;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MaxFunction extends AggregateFunction {

    @Override
    public String getName() {
        return "MAX";
    }

    @Override
    protected double aggregate(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return 0;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double number : numbers) {
            max = Math.max(max, number);
        }
        return max;
    }
}
