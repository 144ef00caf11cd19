package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Address;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One CellResult per non-blank cell of the evaluated sheet, in row-major order,
 * plus the sheet's dependency graph.
 */
public final class EvaluationResult {
    private final SortedMap<Address, CellResult> byAddress;
    private final DependencyGraph dependencies;

    public EvaluationResult(SortedMap<Address, CellResult> byAddress, DependencyGraph dependencies) {
        this.byAddress = Collections.unmodifiableSortedMap(new TreeMap<>(byAddress));
        this.dependencies = dependencies;
    }

    public SortedMap<Address, CellResult> getByAddress() {
        return byAddress;
    }

    /**
     * Result for the cell, or null if it is blank.
     */
    public CellResult get(Address address) {
        return byAddress.get(address);
    }

    public CellResult get(String address) {
        return get(Address.parse(address));
    }

    public DependencyGraph getDependencies() {
        return dependencies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult that = (EvaluationResult) o;
        return byAddress.equals(that.byAddress) && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(byAddress, dependencies);
    }

    @Override
    public String toString() {
        return "EvaluationResult" + byAddress.values();
    }
}
