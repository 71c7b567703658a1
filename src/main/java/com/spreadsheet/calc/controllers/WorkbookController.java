package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.evaluator.FormulaValue;
import com.spreadsheet.calc.models.CreateWorkbookRequest;
import com.spreadsheet.calc.services.CalculationOptions;
import com.spreadsheet.calc.services.CalculationStats;
import com.spreadsheet.calc.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for workbooks.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Body (optional): { "sheets": ["Sheet1", ...], "date1904": false }.
     * Returns the new workbook's ID.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook(@RequestBody(required = false) CreateWorkbookRequest request) {
        CreateWorkbookRequest body = request == null ? new CreateWorkbookRequest() : request;
        long workbookId = workbookService.createWorkbook(body.getSheets(), body.isDate1904());
        return ResponseEntity.ok(workbookId);
    }

    /**
     * POST /workbook/{workbookId}/sheet
     * Body: the sheet name. Returns the new sheet's index.
     */
    @PostMapping("/{workbookId}/sheet")
    public ResponseEntity<Integer> addWorksheet(@PathVariable long workbookId, @RequestBody String name) {
        return ResponseEntity.ok(workbookService.addWorksheet(workbookId, name));
    }

    /**
     * PUT /workbook/{workbookId}/sheet/{sheet}/cell/{address}
     * Body: raw cell text, a literal or a formula starting with '='.
     * A formula that does not parse is rejected with 400 and the cell keeps its old content.
     */
    @PutMapping("/{workbookId}/sheet/{sheet}/cell/{address}")
    public ResponseEntity<Void> setCell(
            @PathVariable long workbookId,
            @PathVariable String sheet,
            @PathVariable String address,
            @RequestBody String rawValue
    ) {
        workbookService.setCell(workbookId, sheet, address, rawValue);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{workbookId}/sheet/{sheet}/cell/{address}")
    public ResponseEntity<Void> clearCell(
            @PathVariable long workbookId,
            @PathVariable String sheet,
            @PathVariable String address
    ) {
        workbookService.clearCell(workbookId, sheet, address);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbook/{workbookId}/sheet/{sheet}
     * Returns calculated values keyed by address: { "A1": 10.0, "A2": "#DIV/0!", ... }.
     */
    @GetMapping("/{workbookId}/sheet/{sheet}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long workbookId, @PathVariable String sheet) {
        return ResponseEntity.ok(workbookService.getSheetData(workbookId, sheet));
    }

    /**
     * PUT /workbook/{workbookId}/name/{name}?sheet=...
     * Body: what the name refers to ("Sheet1!A1:B3", "=A1*2", "0.2").
     * Without the sheet parameter the name is workbook-scoped.
     */
    @PutMapping("/{workbookId}/name/{name}")
    public ResponseEntity<Void> defineName(
            @PathVariable long workbookId,
            @PathVariable String name,
            @RequestParam(required = false) String sheet,
            @RequestBody String refersTo
    ) {
        workbookService.defineName(workbookId, name, refersTo, sheet);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /workbook/{workbookId}/calculate
     * Body (optional): calculation options; missing fields keep the configured defaults.
     */
    @PostMapping("/{workbookId}/calculate")
    public ResponseEntity<CalculationStats> calculate(
            @PathVariable long workbookId,
            @RequestBody(required = false) CalculationOptions options
    ) {
        return ResponseEntity.ok(workbookService.calculate(workbookId, options));
    }

    /**
     * POST /workbook/{workbookId}/sheet/{sheet}/evaluate?at=B2
     * Body: formula text. Returns { "value": ... } without storing anything.
     */
    @PostMapping("/{workbookId}/sheet/{sheet}/evaluate")
    public ResponseEntity<Map<String, Object>> evaluate(
            @PathVariable long workbookId,
            @PathVariable String sheet,
            @RequestParam(required = false) String at,
            @RequestBody String formula
    ) {
        FormulaValue value = workbookService.evaluateFormula(workbookId, sheet, at, formula);
        return ResponseEntity.ok(Collections.singletonMap("value", WorkbookService.toPlainValue(value)));
    }

    /**
     * GET /workbook/{workbookId}/forwardDependencies
     * For each referenced cell, the formula cells that read it.
     */
    @GetMapping("/{workbookId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getForwardDependencies(workbookId));
    }

    /**
     * GET /workbook/{workbookId}/reverseDependencies
     * For each formula cell, the cells it reads.
     */
    @GetMapping("/{workbookId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getReverseDependencies(workbookId));
    }
}
