package com.spreadsheet.engine.formula.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up formula functions by name or alias.
 */
@Component
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FormulaFunction> functions = new LinkedHashMap<>();

    public FunctionRegistry(List<FormulaFunction> formulaFunctions) {
        for (FormulaFunction function : formulaFunctions) {
            register(function.getName(), function);
            for (String alias : function.getAliases()) {
                register(alias, function);
            }
        }
        log.info("Registered {} formula functions: {}", functions.size(), functions.keySet());
    }

    private void register(String name, FormulaFunction function) {
        FormulaFunction existing = functions.putIfAbsent(name, function);
        if (existing != null) {
            throw new IllegalStateException("Formula function " + name + " is registered twice");
        }
    }

    public Optional<FormulaFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
