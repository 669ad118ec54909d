package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.CellNotFoundException;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.DependencyGraph;
import com.spreadsheet.engine.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating sheets, editing cells and keeping
 * every formula's value current after each edit.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent DB
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FormulaEngine engine;

    public SheetService(FormulaEngine engine) {
        this.engine = engine;
    }

    /**
     * Creates a new Sheet, optionally pre-filled with address -> raw value
     * entries, evaluates it and returns its ID.
     */
    public long createSheet(Map<String, String> initialCells) {
        Sheet sheet = new Sheet();
        if (initialCells != null) {
            for (Map.Entry<String, String> entry : initialCells.entrySet()) {
                CellAddress.decode(entry.getKey());
                if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                    sheet.getCells().put(entry.getKey(), new Cell(entry.getValue()));
                }
            }
        }
        recomputeAll(sheet);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} with {} cells", sheet.getId(), sheet.getCells().size());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's raw value with these steps:
     * 1) Validate the address (else throw InvalidAddressException).
     * 2) Replace the cell, or delete it for an empty value.
     * 3) Rebuild the dependency graph before anything is evaluated.
     * 4) Evaluate the cell itself if it holds a formula.
     * 5) Recalculate its dependents and store their new values.
     * Returns the edited cell's value plus every dependent that changed.
     * If anything unexpected fails, the cell and graph are reverted.
     */
    public Map<String, String> setCellValue(long sheetId, String address, String rawValue) {
        CellAddress.decode(address);
        Sheet sheet = getSheet(sheetId);

        // One edit, including its recalculation, completes before the next starts
        sheet.getLock().writeLock().lock();
        try {
            Map<String, Cell> cells = sheet.getCells();
            Cell oldCell = cells.get(address);
            DependencyGraph oldGraph = sheet.getGraph();

            try {
                Map<String, String> changes = new LinkedHashMap<>();
                if (rawValue == null || rawValue.isEmpty()) {
                    cells.remove(address);
                    changes.put(address, "");
                } else {
                    cells.put(address, replacement(oldCell, rawValue));
                }

                DependencyGraph graph = engine.build(cells);
                sheet.setGraph(graph);

                Cell edited = cells.get(address);
                if (edited != null) {
                    if (edited.hasFormula()) {
                        edited.applyResult(engine.evaluate(edited.getFormula(), address, cells));
                    }
                    changes.put(address, edited.getDisplayValue());
                }

                Map<String, String> recalculated = engine.recalculate(cells, graph, address);
                applyResults(cells, recalculated);
                changes.putAll(recalculated);

                log.debug("Sheet {}: set {} -> {} changed cells", sheetId, address, changes.size());
                return changes;
            } catch (RuntimeException | Error ex) {
                // Revert the edit, then let the controller handle it
                if (oldCell == null) {
                    cells.remove(address);
                } else {
                    cells.put(address, oldCell);
                }
                sheet.setGraph(oldGraph);
                throw ex;
            }
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public Map<String, String> clearCell(long sheetId, String address) {
        return setCellValue(sheetId, address, null);
    }

    /**
     * Applies several edits at once, rebuilds the graph a single time,
     * re-evaluates every formula and returns the cells whose value changed.
     */
    public Map<String, String> updateCells(long sheetId, Map<String, String> updates) {
        for (String address : updates.keySet()) {
            CellAddress.decode(address);
        }
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            Map<String, String> before = displayValues(sheet);
            Map<String, Cell> cells = sheet.getCells();
            for (Map.Entry<String, String> update : updates.entrySet()) {
                String rawValue = update.getValue();
                if (rawValue == null || rawValue.isEmpty()) {
                    cells.remove(update.getKey());
                } else {
                    cells.put(update.getKey(), replacement(cells.get(update.getKey()), rawValue));
                }
            }
            recomputeAll(sheet);
            return diff(before, displayValues(sheet));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-evaluates the whole sheet, e.g. after new lookup data arrived.
     * Returns the cells whose value changed.
     */
    public Map<String, String> evaluateSheet(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            Map<String, String> before = displayValues(sheet);
            recomputeAll(sheet);
            return diff(before, displayValues(sheet));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns address -> displayed value for all cells, row by row.
     * No evaluation here, because each cell's value is stored at edit time.
     */
    public Map<String, String> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return displayValues(sheet);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a copy of one cell. Throws CellNotFoundException for an empty cell.
     */
    public Cell getCell(long sheetId, String address) {
        CellAddress.decode(address);
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Cell cell = sheet.getCell(address);
            if (cell == null) {
                throw new CellNotFoundException("Cell " + address + " not found in sheet " + sheetId);
            }
            return new Cell(cell);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Cells that an edit of 'address' would recalculate, in breadth-first order.
     */
    public List<String> getAffectedCells(long sheetId, String address) {
        CellAddress.decode(address);
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return engine.affectedCells(sheet.getGraph(), address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return copyOf(sheet.getGraph().getForwardGraph());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return copyOf(sheet.getGraph().getReverseGraph());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * New cell for rawValue that keeps the display format of the cell it replaces.
     */
    private static Cell replacement(Cell oldCell, String rawValue) {
        Cell cell = new Cell(rawValue);
        if (oldCell != null) {
            cell.setDisplayFormat(oldCell.getDisplayFormat());
        }
        return cell;
    }

    private void recomputeAll(Sheet sheet) {
        Map<String, Cell> cells = sheet.getCells();
        DependencyGraph graph = engine.build(cells);
        sheet.setGraph(graph);
        applyResults(cells, engine.evaluateAll(cells, graph));
    }

    private static void applyResults(Map<String, Cell> cells, Map<String, String> results) {
        for (Map.Entry<String, String> result : results.entrySet()) {
            Cell cell = cells.get(result.getKey());
            if (cell != null && cell.hasFormula()) {
                cell.applyResult(result.getValue());
            }
        }
    }

    private static Map<String, String> displayValues(Sheet sheet) {
        Map<String, String> data = new LinkedHashMap<>();
        for (String address : FormulaEngine.sortedAddresses(sheet.getCells().keySet())) {
            data.put(address, sheet.getCell(address).getDisplayValue());
        }
        return data;
    }

    /**
     * Entries of 'after' that differ from 'before', plus removed cells mapped to "".
     */
    private static Map<String, String> diff(Map<String, String> before, Map<String, String> after) {
        Map<String, String> changes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : after.entrySet()) {
            if (!entry.getValue().equals(before.get(entry.getKey()))) {
                changes.put(entry.getKey(), entry.getValue());
            }
        }
        for (String address : before.keySet()) {
            if (!after.containsKey(address)) {
                changes.put(address, "");
            }
        }
        return changes;
    }

    private static Map<String, Set<String>> copyOf(Map<String, Set<String>> graph) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            copy.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        return copy;
    }
}
