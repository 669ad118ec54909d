package com.spreadsheet.engine.formula.functions;

import com.spreadsheet.engine.formula.CellValueResolver;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Component
public class ConcatenateFunction implements FormulaFunction {

    @Override
    public String getName() {
        return "CONCATENATE";
    }

    @Override
    public List<String> getAliases() {
        return Collections.singletonList("CONCAT");
    }

    @Override
    public String apply(List<String> arguments, CellValueResolver resolver) {
        StringBuilder result = new StringBuilder();
        for (String argument : arguments) {
            result.append(resolver.resolveValue(argument));
        }
        return result.toString();
    }
}
