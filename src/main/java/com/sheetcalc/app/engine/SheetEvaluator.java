package com.sheetcalc.app.engine;

import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.functions.FunctionRegistry;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.PageRef;
import com.sheetcalc.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Entry point of the formula engine. Evaluates every non-blank cell of a sheet:
 * - literals are returned as numbers or text
 * - formulas are parsed (once per distinct input) and evaluated in dependency order
 * - cells on a cycle become CIRCULAR errors, cells reading a failed cell become PROPAGATED errors
 * - cross-page references are answered by the given resolver, at most once per page per call
 * Evaluation never throws for bad formulas and never modifies the sheet.
 * Instances are immutable apart from the parse cache and may be shared between threads.
 */
public class SheetEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SheetEvaluator.class);

    /** Page id used for a sheet evaluated without its own id. */
    public static final String LOCAL_PAGE_ID = "__local__";
    public static final int DEFAULT_PARSE_CACHE_SIZE = 1024;
    public static final long DEFAULT_MAX_RANGE_CELLS = 100_000;

    private final FormulaCache formulas;
    private final FunctionRegistry functions;
    private final long maxRangeCells;

    public SheetEvaluator(FormulaCache formulas, FunctionRegistry functions, long maxRangeCells) {
        this.formulas = Objects.requireNonNull(formulas, "formulas");
        this.functions = Objects.requireNonNull(functions, "functions");
        this.maxRangeCells = Math.max(1, maxRangeCells);
    }

    public SheetEvaluator() {
        this(new FormulaCache(DEFAULT_PARSE_CACHE_SIZE), FunctionRegistry.withDefaults(Clock.systemUTC()),
                DEFAULT_MAX_RANGE_CELLS);
    }

    public FormulaCache getFormulas() {
        return formulas;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    /**
     * Evaluates a standalone sheet. Cross-page references evaluate to REF errors.
     */
    public EvaluationResult evaluate(Sheet sheet) {
        return evaluate(sheet, LOCAL_PAGE_ID, null, null);
    }

    public EvaluationResult evaluate(Sheet sheet, String pageId, ExternalReferenceResolver resolver) {
        return evaluate(sheet, pageId, null, resolver);
    }

    /**
     * Evaluates a sheet that belongs to page {@code pageId}. The id lets a cycle that leaves the page
     * and comes back be recognised as the same cells.
     *
     * @param resolver may be null, in which case cross-page references are REF errors
     */
    public EvaluationResult evaluate(Sheet sheet, String pageId, String pageTitle,
                                     ExternalReferenceResolver resolver) {
        Objects.requireNonNull(sheet, "sheet");
        String id = pageId == null || pageId.trim().isEmpty() ? LOCAL_PAGE_ID : pageId;

        EvaluationContext context = new EvaluationContext(this, resolver);
        PageState page = context.registerPage(id, pageTitle, sheet);

        SortedMap<Address, CellResult> results = new TreeMap<>();
        for (Address address : sheet.getCells().keySet()) {
            results.put(address, context.evaluateCell(page, address));
        }

        long errors = results.values().stream().filter(CellResult::isError).count();
        log.debug("Evaluated page {}: {} cells, {} errors, {} resolver calls",
                id, results.size(), errors, context.getResolverCalls());
        return new EvaluationResult(results, page.getGraph());
    }

    /**
     * Dependency graph of a sheet without evaluating it.
     */
    public DependencyGraph dependencies(Sheet sheet) {
        return DependencyGraph.build(sheet, formulas, maxRangeCells);
    }

    /**
     * Every page mentioned by the sheet's formulas, grouped by mentioning cell in row-major order.
     */
    public Set<PageRef> externalReferences(Sheet sheet) {
        Set<PageRef> pages = new LinkedHashSet<>();
        for (Map.Entry<Address, SortedSet<ExternalDependency>> entry : dependencies(sheet).getExternal().entrySet()) {
            for (ExternalDependency dependency : entry.getValue()) {
                pages.add(dependency.getReference().getPage());
            }
        }
        return pages;
    }
}
