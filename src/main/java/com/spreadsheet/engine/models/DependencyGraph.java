package com.spreadsheet.engine.models;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two adjacency maps over cell addresses, always exact inverses of each other:
 * - dependencies: formula cell -> cells it reads
 * - dependents:   cell -> formula cells that read it
 * Only addresses are stored, never cell contents.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();

    /**
     * Registers a formula cell, so it appears in the forward graph
     * even when it references nothing.
     */
    public void addFormulaCell(String formulaCell) {
        dependencies.computeIfAbsent(formulaCell, k -> new LinkedHashSet<>());
    }

    /**
     * Adds an edge 'formulaCell' -> 'reference' in the forward graph,
     * and 'reference' -> 'formulaCell' in the reverse graph.
     */
    public void addDependency(String formulaCell, String reference) {
        dependencies.computeIfAbsent(formulaCell, k -> new LinkedHashSet<>()).add(reference);
        dependents.computeIfAbsent(reference, k -> new LinkedHashSet<>()).add(formulaCell);
    }

    public Set<String> getDependencies(String cell) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<String> getDependents(String cell) {
        return Collections.unmodifiableSet(dependents.getOrDefault(cell, Collections.emptySet()));
    }

    public Map<String, Set<String>> getForwardGraph() {
        return Collections.unmodifiableMap(dependencies);
    }

    public Map<String, Set<String>> getReverseGraph() {
        return Collections.unmodifiableMap(dependents);
    }

    public int edgeCount() {
        int edges = 0;
        for (Set<String> references : dependencies.values()) {
            edges += references.size();
        }
        return edges;
    }

    /**
     * Orders the given cells so that every cell comes after the cells it
     * depends on (considering only edges inside the given collection).
     * Cells stuck in a cycle keep their incoming order and go last.
     */
    public List<String> topologicalOrder(Collection<String> cells) {
        Set<String> subset = new LinkedHashSet<>(cells);
        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String cell : subset) {
            int count = 0;
            for (String dependency : getDependencies(cell)) {
                if (subset.contains(dependency) && !dependency.equals(cell)) {
                    count++;
                }
            }
            pending.put(cell, count);
            if (count == 0) {
                ready.add(cell);
            }
        }

        List<String> ordered = new ArrayList<>(subset.size());
        Set<String> emitted = new LinkedHashSet<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            ordered.add(current);
            emitted.add(current);
            for (String dependent : getDependents(current)) {
                if (!subset.contains(dependent) || dependent.equals(current) || emitted.contains(dependent)) {
                    continue;
                }
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        for (String cell : subset) {
            if (!emitted.contains(cell)) {
                ordered.add(cell);
            }
        }
        return ordered;
    }
}
