package com.sheetcalc.app.services;

import com.sheetcalc.app.config.EngineProperties;
import com.sheetcalc.app.engine.DependencyGraph;
import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.engine.ExternalDependency;
import com.sheetcalc.app.engine.ExternalReferenceResolver;
import com.sheetcalc.app.engine.ResolvedPage;
import com.sheetcalc.app.engine.SheetEvaluator;
import com.sheetcalc.app.exceptions.InvalidCellAddressException;
import com.sheetcalc.app.exceptions.PageNotFoundException;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Page;
import com.sheetcalc.app.models.PageRef;
import com.sheetcalc.app.models.Sheet;
import com.sheetcalc.app.serialization.SheetDocCodec;
import com.sheetcalc.app.serialization.SheetTextSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory page store and the engine's host:
 * - creates pages and edits their cells under a per-page write lock
 * - evaluates a page on a snapshot, resolving "@[Title](id)" mentions against the other pages
 * - exports and imports pages in the text form and as SheetDoc
 */
@Service
public class PageService implements ExternalReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(PageService.class);

    // All pages live here in memory; no persistent store
    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final AtomicLong sequenceGenerator = new AtomicLong();

    private final SheetEvaluator evaluator;
    private final SheetTextSerializer textSerializer;
    private final SheetDocCodec sheetDocCodec;
    private final EngineProperties properties;

    @Autowired
    public PageService(SheetEvaluator evaluator, SheetTextSerializer textSerializer,
                       SheetDocCodec sheetDocCodec, EngineProperties properties) {
        this.evaluator = evaluator;
        this.textSerializer = textSerializer;
        this.sheetDocCodec = sheetDocCodec;
        this.properties = properties;
    }

    /**
     * Standalone store with the default engine settings.
     */
    public PageService() {
        this(new SheetEvaluator(), new SheetTextSerializer(), new SheetDocCodec(), new EngineProperties());
    }

    /**
     * Creates a page and returns its id.
     *
     * @param id      requested id, or null to generate one
     * @param rows    row extent, or null/non-positive for the configured default
     * @param columns column extent, or null/non-positive for the configured default
     */
    public String createPage(String id, String title, Integer rows, Integer columns) {
        String pageId = id == null || id.trim().isEmpty() ? nextId() : id.trim();
        String pageTitle = title == null || title.trim().isEmpty() ? "Page " + pageId : title.trim();
        int rowCount = rows == null || rows <= 0 ? properties.getDefaultRows() : rows;
        int columnCount = columns == null || columns <= 0 ? properties.getDefaultColumns() : columns;

        Page page = new Page(pageId, pageTitle, sequenceGenerator.getAndIncrement(), new Sheet(rowCount, columnCount));
        if (pages.putIfAbsent(pageId, page) != null) {
            throw new IllegalArgumentException("Page already exists: " + pageId);
        }
        log.info("Created page {} \"{}\" ({}x{})", pageId, pageTitle, rowCount, columnCount);
        return pageId;
    }

    public String createPage(String title) {
        return createPage(null, title, null, null);
    }

    private String nextId() {
        String candidate;
        do {
            candidate = "page-" + idGenerator.getAndIncrement();
        } while (pages.containsKey(candidate));
        return candidate;
    }

    /**
     * Retrieves a page by id. Throws if not found.
     */
    public Page getPage(String pageId) {
        Page page = pages.get(pageId);
        if (page == null) {
            throw new PageNotFoundException("Page not found: " + pageId);
        }
        return page;
    }

    /**
     * Sets one cell's raw input; an empty or whitespace-only input clears the cell.
     * Formulas are stored as written, even when they don't parse: errors show up on evaluation.
     */
    public void setCell(String pageId, String address, String rawInput) {
        Map<String, String> single = new LinkedHashMap<>();
        single.put(address, rawInput);
        setCells(pageId, single);
    }

    /**
     * Sets several cells at once. Every address is validated before any cell changes.
     */
    public void setCells(String pageId, Map<String, String> inputs) {
        Page page = getPage(pageId);
        Map<Address, String> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : inputs.entrySet()) {
            parsed.put(parseAddress(entry.getKey()), entry.getValue() == null ? "" : entry.getValue());
        }

        page.getLock().writeLock().lock();
        try {
            for (Map.Entry<Address, String> entry : parsed.entrySet()) {
                page.getSheet().setCell(entry.getKey(), entry.getValue());
            }
        } finally {
            page.getLock().writeLock().unlock();
        }
        log.debug("Updated {} cell(s) on page {}", parsed.size(), pageId);
    }

    private static Address parseAddress(String address) {
        if (address == null || !Address.isValid(address.trim())) {
            throw new InvalidCellAddressException("Invalid cell address: \"" + address
                    + "\". Use A1-style format (e.g., A1, B2, AA100).");
        }
        return Address.parse(address.trim());
    }

    /**
     * Evaluates the page on a snapshot of its sheet. Other pages are read through {@link #resolve(PageRef)}.
     */
    public EvaluationResult evaluate(String pageId) {
        Page page = getPage(pageId);
        Sheet snapshot = page.snapshot();
        EvaluationResult result = evaluator.evaluate(snapshot, page.getId(), page.getTitle(), this);
        log.debug("Evaluated page {} ({} cells)", pageId, result.getByAddress().size());
        return result;
    }

    /**
     * Looks a mention up by id first, then by title (case-insensitive).
     */
    @Override
    public ResolvedPage resolve(PageRef reference) {
        Page page = null;
        if (reference.getIdentifier() != null) {
            page = pages.get(reference.getIdentifier());
        }
        if (page == null) {
            page = findByTitle(reference.getNormalizedLabel());
        }
        if (page == null) {
            return ResolvedPage.failed(reference.getKey(), reference.getLabel(),
                    "Page \"" + reference.getLabel() + "\" not found");
        }
        return ResolvedPage.found(page.getId(), page.getTitle(), page.snapshot());
    }

    private Page findByTitle(String normalizedTitle) {
        // The earliest created page wins when titles collide
        return pages.values().stream()
                .filter(p -> p.getTitle().toLowerCase(Locale.ROOT).equals(normalizedTitle))
                .min(Comparator.comparingLong(Page::getSequence))
                .orElse(null);
    }

    /**
     * Forward adjacency: cell -> the cells (and cross-page targets) its formula reads.
     */
    public Map<String, List<String>> getForwardDependencies(String pageId) {
        DependencyGraph graph = evaluator.dependencies(getPage(pageId).snapshot());
        Map<String, List<String>> forward = new LinkedHashMap<>();
        TreeSet<Address> sources = new TreeSet<>(graph.sources());
        sources.addAll(graph.getExternal().keySet());
        for (Address source : sources) {
            List<String> targets = names(graph.dependsOn(source));
            for (ExternalDependency external : graph.externalDependencies(source)) {
                targets.add(external.toString());
            }
            if (!targets.isEmpty()) {
                forward.put(source.toString(), targets);
            }
        }
        return forward;
    }

    /**
     * Reverse adjacency: cell -> the cells whose formulas read it.
     */
    public Map<String, List<String>> getReverseDependencies(String pageId) {
        DependencyGraph graph = evaluator.dependencies(getPage(pageId).snapshot());
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (Map.Entry<Address, SortedSet<Address>> entry : graph.getReverse().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                reverse.put(entry.getKey().toString(), names(entry.getValue()));
            }
        }
        return reverse;
    }

    private static List<String> names(SortedSet<Address> addresses) {
        List<String> names = new ArrayList<>();
        for (Address address : addresses) {
            names.add(address.toString());
        }
        return names;
    }

    public String exportRawText(String pageId) {
        return textSerializer.toRawText(getPage(pageId).snapshot());
    }

    public String exportDisplayText(String pageId) {
        Page page = getPage(pageId);
        Sheet snapshot = page.snapshot();
        EvaluationResult result = evaluator.evaluate(snapshot, page.getId(), page.getTitle(), this);
        return textSerializer.toDisplayText(snapshot, result);
    }

    /**
     * Replaces the page's sheet with the one read from the raw text form.
     */
    public void importRawText(String pageId, String text) {
        Page page = getPage(pageId);
        Sheet sheet = textSerializer.parse(text);
        replaceSheet(page, sheet);
        log.info("Imported {} cell(s) into page {} from text", sheet.getCells().size(), pageId);
    }

    public String exportSheetDoc(String pageId) {
        Page page = getPage(pageId);
        Sheet snapshot = page.snapshot();
        EvaluationResult result = evaluator.evaluate(snapshot, page.getId(), page.getTitle(), this);
        return sheetDocCodec.write(snapshot, result, page.getId());
    }

    public void importSheetDoc(String pageId, String text) {
        Page page = getPage(pageId);
        Sheet sheet = sheetDocCodec.read(text);
        replaceSheet(page, sheet);
        log.info("Imported {} cell(s) into page {} from SheetDoc", sheet.getCells().size(), pageId);
    }

    private static void replaceSheet(Page page, Sheet sheet) {
        page.getLock().writeLock().lock();
        try {
            page.setSheet(sheet);
        } finally {
            page.getLock().writeLock().unlock();
        }
    }
}
