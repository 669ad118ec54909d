package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaEvaluationException;
import com.spreadsheet.engine.models.Cell;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one top-level evaluation: the cell table being read, the
 * set of formula cells currently being evaluated and the current expression
 * nesting. A context is never shared between top-level calls, and it is idle
 * again once the call returns.
 */
public class EvaluationContext implements CellValueResolver {

    private final Map<String, Cell> cells;
    private final FormulaEvaluator evaluator;
    private final long maxRangeCells;
    private final int maxDepth;
    private final int maxNesting;
    private final Set<String> inProgress = new LinkedHashSet<>();
    private int nesting;

    EvaluationContext(Map<String, Cell> cells, FormulaEvaluator evaluator,
                      long maxRangeCells, int maxDepth, int maxNesting) {
        this.cells = cells;
        this.evaluator = evaluator;
        this.maxRangeCells = maxRangeCells;
        this.maxDepth = maxDepth;
        this.maxNesting = maxNesting;
    }

    Cell getCell(String address) {
        return cells.get(address);
    }

    boolean isInProgress(String cellId) {
        return inProgress.contains(cellId);
    }

    /**
     * Marks a cell as being evaluated. The caller must call {@link #end(String)}
     * in a finally block, even when this method throws.
     */
    void begin(String cellId) {
        inProgress.add(cellId);
        if (inProgress.size() > maxDepth) {
            throw new FormulaEvaluationException("Formula nesting deeper than " + maxDepth + " cells at " + cellId);
        }
    }

    void end(String cellId) {
        inProgress.remove(cellId);
    }

    /**
     * Enters one level of expression nesting. Like {@link #begin(String)},
     * it must be paired with {@link #exitExpression()} in a finally block.
     */
    void enterExpression() {
        nesting++;
        if (nesting > maxNesting) {
            throw new FormulaEvaluationException("Formula nested deeper than " + maxNesting + " levels");
        }
    }

    void exitExpression() {
        nesting--;
    }

    int getMaxNesting() {
        return maxNesting;
    }

    /**
     * Checks every reference in a formula body, so a formula with an unusable
     * reference fails as a whole instead of only on the branches it takes.
     */
    void checkReferences(String formulaBody) {
        FormulaTokenizer.extractReferences(formulaBody, maxRangeCells);
    }

    boolean isIdle() {
        return inProgress.isEmpty() && nesting == 0;
    }

    @Override
    public String resolveCell(String address) {
        return evaluator.resolveCell(address, this);
    }

    @Override
    public String resolveValue(String argument) {
        return evaluator.resolveValue(argument, this);
    }

    @Override
    public List<String> expandRange(String range) {
        return FormulaTokenizer.expandRange(range, maxRangeCells);
    }
}
