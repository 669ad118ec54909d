package com.spreadsheet.engine.models;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - A map of address ("A1") -> Cell
 * - The dependency graph built from the current cells
 * - A read/write lock so that one edit, including its recalculation,
 *   finishes before the next one starts
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();
    private volatile DependencyGraph graph = new DependencyGraph();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    public Cell getCell(String address) {
        return cells.get(address);
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public void setGraph(DependencyGraph graph) {
        this.graph = graph;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
