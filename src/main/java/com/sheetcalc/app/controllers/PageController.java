package com.sheetcalc.app.controllers;

import com.sheetcalc.app.engine.CellResult;
import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.services.PageService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST endpoints for pages and their sheets.
 * "/pages" is the base path.
 */
@RestController
@RequestMapping("/pages")
public class PageController {

    @Autowired
    private PageService pageService;

    /**
     * POST /pages
     * Body: { "id"?, "title"?, "rows"?, "columns"? }.
     * Creates an empty page and returns { "id": pageId }.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> createPage(@RequestBody(required = false) CreatePageRequest request) {
        CreatePageRequest body = request == null ? new CreatePageRequest() : request;
        String pageId = pageService.createPage(body.getId(), body.getTitle(), body.getRows(), body.getColumns());
        return ResponseEntity.ok(Collections.singletonMap("id", pageId));
    }

    /**
     * PUT /pages/{pageId}/cells/{address}
     * Body: the raw input (literal or "=formula"). An empty body clears the cell.
     * Bad formulas are accepted and show up as PARSE errors on GET.
     */
    @PutMapping(value = "/{pageId}/cells/{address}", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Void> setCell(@PathVariable String pageId,
                                        @PathVariable String address,
                                        @RequestBody(required = false) String rawInput) {
        pageService.setCell(pageId, address, rawInput == null ? "" : rawInput);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /pages/{pageId}/cells
     * Body: [ { "address": "A1", "value": "10" }, ... ], applied all-or-nothing.
     */
    @PutMapping("/{pageId}/cells")
    public ResponseEntity<Void> setCells(@PathVariable String pageId, @RequestBody List<CellUpdate> updates) {
        Map<String, String> inputs = new LinkedHashMap<>();
        for (CellUpdate update : updates) {
            inputs.put(update.getAddress(), update.getValue());
        }
        pageService.setCells(pageId, inputs);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /pages/{pageId}
     * Evaluates the page and returns { "A1": { raw, value, display, type, ... }, ... } in row-major order.
     */
    @GetMapping("/{pageId}")
    public ResponseEntity<Map<String, CellView>> getPage(@PathVariable String pageId) {
        EvaluationResult result = pageService.evaluate(pageId);
        Map<String, CellView> cells = new LinkedHashMap<>();
        for (CellResult cell : result.getByAddress().values()) {
            cells.put(cell.getAddress().toString(), CellView.from(cell));
        }
        return ResponseEntity.ok(cells);
    }

    /**
     * GET /pages/{pageId}/forwardDependencies
     * For each formula cell, the cells (and cross-page targets) it reads.
     */
    @GetMapping("/{pageId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencies(@PathVariable String pageId) {
        return ResponseEntity.ok(pageService.getForwardDependencies(pageId));
    }

    /**
     * GET /pages/{pageId}/reverseDependencies
     * For each referenced cell, the formula cells that read it.
     */
    @GetMapping("/{pageId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencies(@PathVariable String pageId) {
        return ResponseEntity.ok(pageService.getReverseDependencies(pageId));
    }

    /**
     * GET /pages/{pageId}/text?view=raw|display
     * The sheet in the line-oriented text form.
     */
    @GetMapping(value = "/{pageId}/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getText(@PathVariable String pageId,
                                          @RequestParam(defaultValue = "raw") String view) {
        switch (view.toLowerCase(Locale.ROOT)) {
            case "raw":
                return ResponseEntity.ok(pageService.exportRawText(pageId));
            case "display":
                return ResponseEntity.ok(pageService.exportDisplayText(pageId));
            default:
                throw new IllegalArgumentException("Unknown view \"" + view + "\". Use raw or display.");
        }
    }

    /**
     * PUT /pages/{pageId}/text
     * Replaces the sheet with the raw text form in the body.
     */
    @PutMapping(value = "/{pageId}/text", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Void> putText(@PathVariable String pageId, @RequestBody String text) {
        pageService.importRawText(pageId, text);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /pages/{pageId}/sheetdoc
     * The page as a SheetDoc (header line plus TOML), including evaluated values.
     */
    @GetMapping(value = "/{pageId}/sheetdoc", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getSheetDoc(@PathVariable String pageId) {
        return ResponseEntity.ok(pageService.exportSheetDoc(pageId));
    }

    /**
     * PUT /pages/{pageId}/sheetdoc
     * Replaces the sheet with the inputs stored in a SheetDoc.
     */
    @PutMapping(value = "/{pageId}/sheetdoc", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Void> putSheetDoc(@PathVariable String pageId, @RequestBody String text) {
        pageService.importSheetDoc(pageId, text);
        return ResponseEntity.ok().build();
    }
}
