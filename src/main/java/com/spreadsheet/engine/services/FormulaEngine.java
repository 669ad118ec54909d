package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.exceptions.FormulaEvaluationException;
import com.spreadsheet.engine.exceptions.InvalidAddressException;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.formula.FormulaTokenizer;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.DependencyGraph;
import com.spreadsheet.engine.models.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point to the formula engine: dependency graph building, full evaluation
 * and incremental recalculation over a cell table owned by the caller.
 * The engine keeps no reference to the table between calls.
 */
@Service
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final FormulaEvaluator evaluator;
    private final RecalculationCoordinator coordinator;
    private final EngineProperties properties;

    public FormulaEngine(FormulaEvaluator evaluator, RecalculationCoordinator coordinator, EngineProperties properties) {
        this.evaluator = evaluator;
        this.coordinator = coordinator;
        this.properties = properties;
    }

    /**
     * Rebuilds the dependency graph from a full snapshot of the cell table.
     * A formula with an unusable reference gets no edges; it evaluates to "#ERROR!".
     */
    public DependencyGraph build(Map<String, Cell> cells) {
        DependencyGraph graph = new DependencyGraph();
        for (String address : sortedAddresses(cells.keySet())) {
            Cell cell = cells.get(address);
            if (!cell.hasFormula()) {
                continue;
            }
            graph.addFormulaCell(address);
            try {
                String body = cell.getFormula().substring(Cell.FORMULA_MARKER.length());
                for (String reference : FormulaTokenizer.extractReferences(body, properties.getMaxRangeCells())) {
                    graph.addDependency(address, reference);
                }
            } catch (InvalidAddressException | FormulaEvaluationException e) {
                log.warn("Formula in {} has an unusable reference and will evaluate to {}: {}",
                        address, ErrorCode.ERROR, e.getMessage());
            }
        }
        log.debug("Built dependency graph: {} formula cells, {} edges",
                graph.getForwardGraph().size(), graph.edgeCount());
        return graph;
    }

    public String evaluate(String formula, String address, Map<String, Cell> cells) {
        return evaluator.evaluate(formula, address, cells);
    }

    /**
     * Computes every cell, e.g. on load: formulas are evaluated, literals
     * report their own value. Ordered row by row.
     */
    public Map<String, String> evaluateAll(Map<String, Cell> cells, DependencyGraph graph) {
        Map<String, String> results = new LinkedHashMap<>();
        for (String address : sortedAddresses(cells.keySet())) {
            Cell cell = cells.get(address);
            if (cell.hasFormula()) {
                results.put(address, evaluator.evaluate(cell.getFormula(), address, cells));
            } else {
                results.put(address, cell.getDisplayValue());
            }
        }
        log.debug("Evaluated {} cells ({} formulas)", results.size(), graph.getForwardGraph().size());
        return results;
    }

    /**
     * Re-evaluates the formulas affected by an edit of editedAddress and
     * returns those whose value changed.
     */
    public Map<String, String> recalculate(Map<String, Cell> cells, DependencyGraph graph, String editedAddress) {
        return coordinator.recalculate(cells, graph, editedAddress);
    }

    public List<String> affectedCells(DependencyGraph graph, String editedAddress) {
        return coordinator.affectedCells(graph, editedAddress);
    }

    /**
     * Addresses in row-major order (A1, B1, ..., A2, ...).
     */
    public static List<String> sortedAddresses(Collection<String> addresses) {
        List<String> sorted = new ArrayList<>(addresses);
        sorted.sort(Comparator.comparing(CellAddress::decode));
        return sorted;
    }
}
