package com.sheetcalc.app.models;

import java.util.Objects;

/**
 * A reference into another page's sheet.
 * The target is a single cell, a range, or nothing at all (a whole-sheet reference).
 * The target is never expanded here: it is only meaningful once the page has been resolved.
 */
public final class CrossPageReference extends CellReference {
    private final PageRef page;
    private final Address address;
    private final Range range;

    private CrossPageReference(PageRef page, Address address, Range range) {
        this.page = Objects.requireNonNull(page, "page");
        this.address = address;
        this.range = range;
    }

    public static CrossPageReference toCell(PageRef page, Address address) {
        return new CrossPageReference(page, Objects.requireNonNull(address, "address"), null);
    }

    public static CrossPageReference toRange(PageRef page, Range range) {
        return new CrossPageReference(page, null, Objects.requireNonNull(range, "range"));
    }

    public static CrossPageReference toWholeSheet(PageRef page) {
        return new CrossPageReference(page, null, null);
    }

    public PageRef getPage() {
        return page;
    }

    /**
     * The target cell, or null for range and whole-sheet references.
     */
    public Address getAddress() {
        return address;
    }

    /**
     * The target range, or null for cell and whole-sheet references.
     */
    public Range getRange() {
        return range;
    }

    public boolean isWholeSheet() {
        return address == null && range == null;
    }

    @Override
    public <R> R accept(ReferenceVisitor<R> visitor) {
        return visitor.visitCrossPage(this);
    }

    @Override
    public boolean isRange() {
        return range != null;
    }

    /**
     * Text of the target part only ("B2", "A1:A3"), or an empty string for a whole-sheet reference.
     */
    public String getTargetText() {
        if (address != null) {
            return address.toString();
        }
        return range != null ? range.toString() : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CrossPageReference)) {
            return false;
        }
        CrossPageReference that = (CrossPageReference) o;
        return page.equals(that.page) && Objects.equals(address, that.address) && Objects.equals(range, that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, address, range);
    }

    @Override
    public String toString() {
        return isWholeSheet() ? page.getRaw() : page.getRaw() + ":" + getTargetText();
    }
}
