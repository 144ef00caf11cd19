package com.sheetcalc.app.engine;

import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.formula.ParsedFormula;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * "Reads from" edges between the cells of one sheet:
 * - forward: cell -> cells its formula reads
 * - reverse: cell -> formula cells that read it
 * - external: cell -> cross-page markers its formula reads (never expanded here)
 * Only formula cells have outgoing edges; formulas that fail to parse have none.
 */
public final class DependencyGraph {

    private final SortedMap<Address, SortedSet<Address>> forward = new TreeMap<>();
    private final SortedMap<Address, SortedSet<Address>> reverse = new TreeMap<>();
    private final SortedMap<Address, SortedSet<ExternalDependency>> external = new TreeMap<>();

    private DependencyGraph() {
    }

    /**
     * Builds the graph for every formula cell of the sheet.
     * Ranges larger than {@code maxRangeCells} only contribute the non-blank cells they cover.
     */
    public static DependencyGraph build(Sheet sheet, FormulaCache formulas, long maxRangeCells) {
        DependencyGraph graph = new DependencyGraph();
        for (Map.Entry<Address, String> cell : sheet.getCells().entrySet()) {
            if (!FormulaCache.isFormula(cell.getValue())) {
                continue;
            }
            ParsedFormula parsed = formulas.parse(cell.getValue());
            if (!parsed.isValid()) {
                continue;
            }
            DependencyCollector collected = DependencyCollector.collect(parsed.getExpression(), sheet, maxRangeCells);
            for (Address target : collected.getLocal()) {
                graph.addDependency(cell.getKey(), target);
            }
            if (!collected.getExternal().isEmpty()) {
                graph.external.computeIfAbsent(cell.getKey(), k -> new TreeSet<>()).addAll(collected.getExternal());
            }
        }
        return graph;
    }

    private void addDependency(Address source, Address target) {
        forward.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
        reverse.computeIfAbsent(target, k -> new TreeSet<>()).add(source);
    }

    /**
     * Cells the given cell's formula reads, in row-major order.
     */
    public SortedSet<Address> dependsOn(Address address) {
        return Collections.unmodifiableSortedSet(forward.getOrDefault(address, Collections.emptySortedSet()));
    }

    /**
     * Formula cells that read the given cell, in row-major order.
     */
    public SortedSet<Address> dependents(Address address) {
        return Collections.unmodifiableSortedSet(reverse.getOrDefault(address, Collections.emptySortedSet()));
    }

    public SortedSet<ExternalDependency> externalDependencies(Address address) {
        return Collections.unmodifiableSortedSet(external.getOrDefault(address, Collections.emptySortedSet()));
    }

    /**
     * Cells with at least one outgoing local edge.
     */
    public Set<Address> sources() {
        return Collections.unmodifiableSet(forward.keySet());
    }

    public SortedMap<Address, SortedSet<Address>> getForward() {
        return Collections.unmodifiableSortedMap(forward);
    }

    public SortedMap<Address, SortedSet<Address>> getReverse() {
        return Collections.unmodifiableSortedMap(reverse);
    }

    public SortedMap<Address, SortedSet<ExternalDependency>> getExternal() {
        return Collections.unmodifiableSortedMap(external);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DependencyGraph)) {
            return false;
        }
        DependencyGraph that = (DependencyGraph) o;
        return forward.equals(that.forward) && external.equals(that.external);
    }

    @Override
    public int hashCode() {
        return Objects.hash(forward, external);
    }
}
