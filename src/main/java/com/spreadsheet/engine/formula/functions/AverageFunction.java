package com.spreadsheet.engine.formula.functions;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Mean of the numeric values; 0 when there are none.
 */
@Component
public class AverageFunction extends AggregateFunction {

    @Override
    public String getName() {
        return "AVERAGE";
    }

    @Override
    public List<String> getAliases() {
        return Collections.singletonList("AVG");
    }

    @Override
    protected double aggregate(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double number : numbers) {
            sum += number;
        }
        return sum / numbers.size();
    }
}
