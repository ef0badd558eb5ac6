package com.gridcalc.app.controllers;

import com.gridcalc.app.models.*;
import com.gridcalc.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for spreadsheet Sheets.
 * "/sheet" is the base path; cells are addressed as "A1", ranges as "A1:C3".
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * JSON body { "rows": 20, "columns": 10 }; missing sizes use the configured defaults.
     * Returns the new sheetId.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Long> createSheet(@RequestBody CreateSheetRequest request) {
        return ResponseEntity.ok(sheetService.createSheet(request.getRows(), request.getColumns()));
    }

    /**
     * POST /sheet?rows=20&columns=10
     * Any other request, including one without a body; sizes may come as parameters.
     */
    @PostMapping
    public ResponseEntity<Long> createSheetWithoutBody(
            @RequestParam(required = false) Integer rows,
            @RequestParam(required = false) Integer columns
    ) {
        return ResponseEntity.ok(sheetService.createSheet(rows, columns));
    }

    /**
     * GET /sheet/{sheetId}
     * Evaluated values row by row, e.g. values[0][1] is B1, plus validationErrors.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<SheetSnapshot> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSnapshot(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/cells
     * Body { "cells": [["1", "=A1*2"], ["x"]] } replaces the whole grid.
     */
    @PutMapping("/{sheetId}/cells")
    public ResponseEntity<SheetSnapshot> loadCells(@PathVariable long sheetId, @RequestBody LoadRequest request) {
        return ResponseEntity.ok(sheetService.loadCells(sheetId, request.getCells()));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw content, a literal or "=formula". An empty body clears the cell.
     * Formula problems are not HTTP errors: they show up as #ERROR! / #CIRCULAR! values.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellView> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, address, rawValue));
    }

    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * PUT /sheet/{sheetId}/validation/{address}
     * Body: "any", "number" or "date" (any case).
     */
    @PutMapping("/{sheetId}/validation/{address}")
    public ResponseEntity<CellView> setValidation(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody String type
    ) {
        return ResponseEntity.ok(sheetService.setValidation(sheetId, address, ValidationType.fromValue(type)));
    }

    @PostMapping("/{sheetId}/rows")
    public ResponseEntity<SheetSnapshot> appendRow(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.appendRow(sheetId));
    }

    @DeleteMapping("/{sheetId}/rows")
    public ResponseEntity<SheetSnapshot> removeLastRow(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.removeLastRow(sheetId));
    }

    @PostMapping("/{sheetId}/columns")
    public ResponseEntity<SheetSnapshot> appendColumn(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.appendColumn(sheetId));
    }

    @DeleteMapping("/{sheetId}/columns")
    public ResponseEntity<SheetSnapshot> removeLastColumn(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.removeLastColumn(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/transform
     * Body { "operation": "TRIM" | "UPPER" | "LOWER", "range": "A1:B4" }; no range = whole sheet.
     */
    @PostMapping("/{sheetId}/transform")
    public ResponseEntity<SheetSnapshot> transform(@PathVariable long sheetId, @RequestBody TransformRequest request) {
        return ResponseEntity.ok(sheetService.transform(sheetId, request.getOperation(), request.getRange()));
    }

    /**
     * POST /sheet/{sheetId}/sort
     * Body { "column": "B", "direction": "DESC", "range": "A2:C20" }.
     */
    @PostMapping("/{sheetId}/sort")
    public ResponseEntity<SheetSnapshot> sort(@PathVariable long sheetId, @RequestBody SortRequest request) {
        return ResponseEntity.ok(sheetService.sort(sheetId, request.getColumn(), request.getDirection(), request.getRange()));
    }

    @PostMapping("/{sheetId}/removeDuplicates")
    public ResponseEntity<SheetSnapshot> removeDuplicates(@PathVariable long sheetId,
                                                          @RequestBody(required = false) RangeRequest request) {
        String range = request == null ? null : request.getRange();
        return ResponseEntity.ok(sheetService.removeDuplicates(sheetId, range));
    }

    /**
     * GET /sheet/{sheetId}/find?text=foo
     * Addresses whose raw content contains the text, row by row.
     */
    @GetMapping("/{sheetId}/find")
    public ResponseEntity<List<String>> find(@PathVariable long sheetId, @RequestParam String text) {
        return ResponseEntity.ok(sheetService.find(sheetId, text));
    }

    /**
     * POST /sheet/{sheetId}/replace
     * Body { "find": "foo", "replace": "bar" }; returns how many cells changed.
     */
    @PostMapping("/{sheetId}/replace")
    public ResponseEntity<Integer> replaceAll(@PathVariable long sheetId, @RequestBody ReplaceRequest request) {
        return ResponseEntity.ok(sheetService.replaceAll(sheetId, request.getFind(), request.getReplace()));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each formula cell => the cells it reads, e.g. { "B1": ["A1"] }.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each referenced cell => the formula cells that read it, e.g. { "A1": ["B1"] }.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
