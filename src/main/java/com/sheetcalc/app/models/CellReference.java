package com.sheetcalc.app.models;

/**
 * A reference written inside a formula. Exactly one of three kinds:
 * - {@link LocalCellReference}: "A1"
 * - {@link LocalRangeReference}: "A1:B2"
 * - {@link CrossPageReference}: "@[Label](id):A1", "@[Label](id):A1:B2" or "@[Label](id)"
 * Callers branch on the kind through {@link ReferenceVisitor}, so every kind must be handled.
 */
public abstract class CellReference {

    CellReference() {
    }

    public abstract <R> R accept(ReferenceVisitor<R> visitor);

    /**
     * True when the reference can yield more than one value.
     */
    public abstract boolean isRange();

    /**
     * The formula text this reference was written as.
     */
    @Override
    public abstract String toString();
}
