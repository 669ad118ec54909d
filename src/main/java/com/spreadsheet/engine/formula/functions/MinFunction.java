package com.spreadsheet.engine.formula.functions;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MinFunction extends AggregateFunction {

    @Override
    public String getName() {
        return "MIN";
    }

    @Override
    protected double aggregate(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return 0;
        }
        double min = Double.POSITIVE_INFINITY;
        for (double number : numbers) {
            min = Math.min(min, number);
        }
        return min;
    }
}
