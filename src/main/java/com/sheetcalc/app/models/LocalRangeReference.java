package com.sheetcalc.app.models;

import java.util.Objects;

public final class LocalRangeReference extends CellReference {
    private final Range range;

    public LocalRangeReference(Range range) {
        this.range = Objects.requireNonNull(range, "range");
    }

    public Range getRange() {
        return range;
    }

    @Override
    public <R> R accept(ReferenceVisitor<R> visitor) {
        return visitor.visitLocalRange(this);
    }

    @Override
    public boolean isRange() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalRangeReference && range.equals(((LocalRangeReference) o).range);
    }

    @Override
    public int hashCode() {
        return range.hashCode();
    }

    @Override
    public String toString() {
        return range.toString();
    }
}
