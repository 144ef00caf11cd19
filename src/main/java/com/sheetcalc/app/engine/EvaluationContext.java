package com.sheetcalc.app.engine;

import com.sheetcalc.app.exceptions.FormulaEvaluationException;
import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.formula.ParsedFormula;
import com.sheetcalc.app.functions.Coercions;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.PageRef;
import com.sheetcalc.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one top-level evaluation call:
 * - the pages reached so far (the evaluated sheet first, then every resolved page)
 * - the resolver and the resolutions it already gave during this call
 * - the visitation set of (page, cell) pairs on the active evaluation stack
 * Created per call and never shared, so independent evaluations can run in parallel.
 * Resolver calls happen one at a time, in the order the depth-first walk reaches them.
 */
public final class EvaluationContext {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContext.class);

    static final String NO_RESOLVER_MESSAGE = "Cross-page references are not supported in this context";

    private final SheetEvaluator engine;
    private final ExternalReferenceResolver resolver;
    private final Map<String, PageState> pages = new HashMap<>();
    private final Map<PageRef, ResolvedPage> resolutions = new HashMap<>();
    private final VisitationSet visitation = new VisitationSet();
    // Cells found on a cycle at run time; they finish as CIRCULAR whatever they computed
    private final Set<CellKey> circular = new HashSet<>();
    private int resolverCalls;

    EvaluationContext(SheetEvaluator engine, ExternalReferenceResolver resolver) {
        this.engine = engine;
        this.resolver = resolver;
    }

    PageState registerPage(String pageId, String title, Sheet sheet) {
        return pages.computeIfAbsent(pageId, id -> {
            DependencyGraph graph = DependencyGraph.build(sheet, engine.getFormulas(), engine.getMaxRangeCells());
            PageState page = new PageState(id, title, sheet, graph);
            if (!page.getCycleMembers().isEmpty()) {
                log.debug("Page {} \"{}\" has circular references at {}", id, page.getTitle(), page.getCycleMembers());
            }
            return page;
        });
    }

    int getResolverCalls() {
        return resolverCalls;
    }

    SheetEvaluator getEngine() {
        return engine;
    }

    /**
     * Evaluates one cell of a page, at most once per call.
     */
    CellResult evaluateCell(PageState page, Address address) {
        CellResult known = page.getResult(address);
        if (known != null) {
            return known;
        }

        CellKey key = new CellKey(page.getPageId(), address);
        String raw = page.getSheet().getRaw(address);
        if (visitation.contains(key)) {
            List<CellKey> cycle = visitation.cycleFrom(key);
            circular.addAll(cycle);
            log.debug("Circular reference through {}", cycle);
            // Not stored: the cell itself is still being evaluated further down the stack
            return new CellResult(address, raw, CellValue.error(CellError.circular()));
        }

        CellResult result;
        if (page.isOnLocalCycle(address)) {
            result = new CellResult(address, raw, CellValue.error(CellError.circular()));
        } else {
            visitation.push(key);
            CellValue value;
            try {
                value = computeValue(page, raw);
            } finally {
                visitation.pop(key);
            }
            if (circular.contains(key)) {
                value = CellValue.error(CellError.circular());
            }
            result = new CellResult(address, raw, value);
        }
        page.putResult(result);
        return result;
    }

    private CellValue computeValue(PageState page, String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return CellValue.blank();
        }
        if (FormulaCache.isFormula(trimmed)) {
            ParsedFormula parsed = engine.getFormulas().parse(trimmed);
            if (!parsed.isValid()) {
                return CellValue.error(ErrorKind.PARSE, parsed.getError());
            }
            return new ExpressionEvaluator(this, page).evaluate(parsed.getExpression());
        }
        if (Coercions.isNumberLiteral(trimmed)) {
            return CellValue.number(Double.parseDouble(trimmed));
        }
        return CellValue.text(raw);
    }

    /**
     * The page a cross-page reference points to, resolving it on first use in this call.
     * Throws FormulaEvaluationException (REF) when the page is unavailable.
     */
    PageState resolvePage(PageRef reference) {
        ResolvedPage resolution = resolutions.computeIfAbsent(reference, this::callResolver);
        if (!resolution.isFound()) {
            throw new FormulaEvaluationException(ErrorKind.REF, resolution.getError());
        }
        return registerPage(resolution.getPageId(), resolution.getPageTitle(), resolution.getSheet());
    }

    private ResolvedPage callResolver(PageRef reference) {
        if (resolver == null) {
            return ResolvedPage.failed(reference.getKey(), reference.getLabel(), NO_RESOLVER_MESSAGE);
        }
        String unavailable = "Referenced page \"" + reference.getLabel() + "\" is not available";
        resolverCalls++;
        ResolvedPage provided;
        try {
            provided = resolver.resolve(reference);
        } catch (RuntimeException e) {
            log.warn("Resolver failed for {}", reference.getRaw(), e);
            return ResolvedPage.failed(reference.getKey(), reference.getLabel(), unavailable);
        }
        if (provided == null) {
            return ResolvedPage.failed(reference.getKey(), reference.getLabel(), unavailable);
        }

        String pageId = isBlank(provided.getPageId()) ? reference.getKey() : provided.getPageId();
        String title = isBlank(provided.getPageTitle()) ? reference.getLabel() : provided.getPageTitle();
        if (!provided.isFound()) {
            String error = isBlank(provided.getError()) ? unavailable : provided.getError();
            return ResolvedPage.failed(pageId, title, error);
        }
        return ResolvedPage.found(pageId, title, provided.getSheet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
