package com.spreadsheet.engine.formula.functions;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SumFunction extends AggregateFunction {

    @Override
    public String getName() {
        return "SUM";
    }

    @Override
    protected double aggregate(List<Double> numbers) {
        double sum = 0;
        for (double number : numbers) {
            sum += number;
        }
        return sum;
    }
}
