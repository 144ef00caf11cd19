package com.sheetcalc.app.formula;

import com.sheetcalc.app.models.CellReference;

import java.util.Objects;

public final class ReferenceExpression implements Expression {
    private final CellReference reference;

    public ReferenceExpression(CellReference reference) {
        this.reference = Objects.requireNonNull(reference, "reference");
    }

    public CellReference getReference() {
        return reference;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReferenceExpression && reference.equals(((ReferenceExpression) o).reference);
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
