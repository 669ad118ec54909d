package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body: { "cells": { "A1": "5", "A2": "=A1*2" } }.
     * Creates a new Sheet with those cells, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, Map<String, String>> request) {
        Map<String, String> cells = request == null ? null : request.get("cells");
        long sheetId = sheetService.createSheet(cells);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the displayed value of every cell, row by row,
     * in the format: { "A1": "5", "A2": "10", "B1": "#CIRCULAR!", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw value (a literal, or a formula starting with "="). An empty body clears the cell.
     * Returns the edited cell's new value plus every dependent whose value changed.
     * Formula errors are values ("#ERROR!", "#CIRCULAR!"); a malformed address is a 400.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Map<String, String>> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, address, rawValue));
    }

    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Map<String, String>> clearCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.clearCell(sheetId, address));
    }

    /**
     * GET /sheet/{sheetId}/cell/{address}
     * Returns the stored cell: rawValue, formula, valueType, value or error.
     */
    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Cell> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * GET /sheet/{sheetId}/cell/{address}/affected
     * Returns the formula cells an edit of this cell recalculates, breadth-first.
     */
    @GetMapping("/{sheetId}/cell/{address}/affected")
    public ResponseEntity<List<String>> getAffectedCells(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getAffectedCells(sheetId, address));
    }

    /**
     * PUT /sheet/{sheetId}/cells
     * Body: { "A1": "1", "B1": "=A1+1" }. Applies all edits, then returns the changed values.
     */
    @PutMapping("/{sheetId}/cells")
    public ResponseEntity<Map<String, String>> updateCells(@PathVariable long sheetId,
                                                           @RequestBody Map<String, String> updates) {
        return ResponseEntity.ok(sheetService.updateCells(sheetId, updates));
    }

    /**
     * POST /sheet/{sheetId}/evaluate
     * Re-evaluates every formula, e.g. after lookup data was pushed, and returns the changed values.
     */
    @PostMapping("/{sheetId}/evaluate")
    public ResponseEntity<Map<String, String>> evaluateSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.evaluateSheet(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each formula cell => the set of cells it reads.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each cell => the set of formula cells that read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
