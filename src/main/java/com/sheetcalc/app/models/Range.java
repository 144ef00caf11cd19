package com.sheetcalc.app.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular block of cells, e.g. "A1:B3".
 * Always normalized so that the start is the top-left corner and the end the bottom-right,
 * whichever order the corners were written in.
 */
public final class Range {
    private final Address start;
    private final Address end;

    public Range(Address first, Address second) {
        this.start = new Address(Math.min(first.getRow(), second.getRow()),
                Math.min(first.getColumn(), second.getColumn()));
        this.end = new Address(Math.max(first.getRow(), second.getRow()),
                Math.max(first.getColumn(), second.getColumn()));
    }

    /**
     * Parses "A1:B2". A single address ("A1") is accepted as a one-cell range.
     */
    public static Range parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            Address single = Address.parse(text);
            return new Range(single, single);
        }
        return new Range(Address.parse(text.substring(0, colon)), Address.parse(text.substring(colon + 1)));
    }

    public Address getStart() {
        return start;
    }

    public Address getEnd() {
        return end;
    }

    public int rowCount() {
        return end.getRow() - start.getRow() + 1;
    }

    public int columnCount() {
        return end.getColumn() - start.getColumn() + 1;
    }

    /**
     * Number of cells covered, computed without expanding.
     */
    public long size() {
        return (long) rowCount() * columnCount();
    }

    public boolean contains(Address address) {
        return address.getRow() >= start.getRow() && address.getRow() <= end.getRow()
                && address.getColumn() >= start.getColumn() && address.getColumn() <= end.getColumn();
    }

    /**
     * Lists every covered address in row-major order. A degenerate range yields its single cell.
     */
    public List<Address> expand() {
        List<Address> addresses = new ArrayList<>((int) Math.min(size(), Integer.MAX_VALUE));
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int column = start.getColumn(); column <= end.getColumn(); column++) {
                addresses.add(new Address(row, column));
            }
        }
        return addresses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range)) {
            return false;
        }
        Range range = (Range) o;
        return start.equals(range.start) && end.equals(range.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
