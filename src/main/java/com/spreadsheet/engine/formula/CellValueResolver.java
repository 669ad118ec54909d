package com.spreadsheet.engine.formula;

import java.util.List;

/**
 * Callback handed to formula functions for turning raw arguments into values.
 * Errors met while resolving (a circular reference, an error value in a
 * referenced cell) are thrown and end the evaluation of the calling formula.
 */
public interface CellValueResolver {

    /**
     * Value of the cell at the given address, evaluating its formula if needed.
     * A missing or blank cell reads as "0".
     */
    String resolveCell(String address);

    /**
     * Value of one raw argument: unquoted literal, cell value, number,
     * or the result of a nested expression.
     */
    String resolveValue(String argument);

    /**
     * Addresses of the cells in a range such as "A1:B3", row by row.
     */
    List<String> expandRange(String range);
}
