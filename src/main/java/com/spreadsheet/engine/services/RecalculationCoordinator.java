package com.spreadsheet.engine.services;

import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Works out which formulas an edit affects and re-evaluates just those.
 */
@Component
public class RecalculationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecalculationCoordinator.class);

    private final FormulaEvaluator evaluator;

    public RecalculationCoordinator(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Breadth-first walk of the reverse graph from the edited cell.
     * Each transitive dependent appears once, in discovery order;
     * the edited cell itself is not included.
     */
    public List<String> affectedCells(DependencyGraph graph, String editedCell) {
        List<String> affected = new ArrayList<>();
        Queue<String> queue = new LinkedList<>();
        Set<String> processed = new HashSet<>();
        queue.add(editedCell);
        processed.add(editedCell);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : graph.getDependents(current)) {
                if (processed.add(dependent)) {
                    affected.add(dependent);
                    queue.add(dependent);
                }
            }
        }
        return affected;
    }

    /**
     * Re-evaluates every formula affected by the edit, once each, upstream first.
     * Returns only the cells whose display value changed. The cell table is not modified.
     */
    public Map<String, String> recalculate(Map<String, Cell> cells, DependencyGraph graph, String editedCell) {
        List<String> affected = affectedCells(graph, editedCell);
        Map<String, String> changed = new LinkedHashMap<>();

        for (String address : graph.topologicalOrder(affected)) {
            Cell cell = cells.get(address);
            if (cell == null || !cell.hasFormula()) {
                continue;
            }
            String newValue = evaluator.evaluate(cell.getFormula(), address, cells);
            if (!newValue.equals(cell.getDisplayValue())) {
                changed.put(address, newValue);
            }
        }

        log.debug("Edit of {} affected {} cells, {} changed", editedCell, affected.size(), changed.size());
        return changed;
    }
}
