package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.CrossPageReference;

import java.util.Objects;

/**
 * Marker for a dependency on another page's cells. The page is identified by its raw
 * identifier (or label) and the target is kept unexpanded until the page is resolved.
 */
public final class ExternalDependency implements Comparable<ExternalDependency> {
    private final CrossPageReference reference;

    public ExternalDependency(CrossPageReference reference) {
        this.reference = Objects.requireNonNull(reference, "reference");
    }

    public CrossPageReference getReference() {
        return reference;
    }

    /**
     * Page id if the formula named one, otherwise the page label.
     */
    public String getPageKey() {
        return reference.getPage().getKey();
    }

    @Override
    public int compareTo(ExternalDependency other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExternalDependency && reference.equals(((ExternalDependency) o).reference);
    }

    @Override
    public int hashCode() {
        return reference.hashCode();
    }

    @Override
    public String toString() {
        return reference.toString();
    }
}
