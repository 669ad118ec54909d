package com.spreadsheet.engine.formula.functions;

import com.spreadsheet.engine.formula.CellValueResolver;

import java.util.Collections;
import java.util.List;

/**
 * A named function callable from a formula, e.g. SUM or IF.
 * Implementations receive raw argument strings and resolve them
 * through the given resolver as needed.
 */
public interface FormulaFunction {

    String getName();

    default List<String> getAliases() {
        return Collections.emptyList();
    }

    /**
     * @return the result, or an error code such as "#ERROR!"
     */
    String apply(List<String> arguments, CellValueResolver resolver);
}
