package com.sheetcalc.app.models;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Represents an entire grid of raw cell inputs:
 * - rowCount / columnCount: the explicit extents of the grid
 * - a row-major map of Address -> raw input ("Revenue", "1000", "=B1-B2")
 * A Sheet never stores evaluated values. Missing entries are blank cells.
 * Not thread-safe; owners guard it themselves.
 */
public class Sheet {

    public static final int DEFAULT_ROWS = 20;
    public static final int DEFAULT_COLUMNS = 10;

    private int rowCount;
    private int columnCount;
    // Address -> raw input, kept in row-major order
    private final SortedMap<Address, String> cells = new TreeMap<>();

    public Sheet() {
        this(DEFAULT_ROWS, DEFAULT_COLUMNS);
    }

    public Sheet(int rowCount, int columnCount) {
        this.rowCount = Math.max(1, rowCount);
        this.columnCount = Math.max(1, columnCount);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    /**
     * Returns the raw input of a cell, or an empty string if the cell is blank.
     */
    public String getRaw(Address address) {
        return cells.getOrDefault(address, "");
    }

    public boolean isBlank(Address address) {
        return !cells.containsKey(address);
    }

    /**
     * Sets a cell's raw input. Empty or whitespace-only input clears the cell.
     * Writing outside the current extents grows them.
     */
    public void setCell(Address address, String rawInput) {
        if (rawInput == null || rawInput.trim().isEmpty()) {
            cells.remove(address);
            return;
        }
        cells.put(address, rawInput);
        rowCount = Math.max(rowCount, address.getRow() + 1);
        columnCount = Math.max(columnCount, address.getColumn() + 1);
    }

    /**
     * Convenience for setCell(Address.parse(address), rawInput).
     */
    public void setCell(String address, String rawInput) {
        setCell(Address.parse(address), rawInput);
    }

    /**
     * Read-only, row-major view of all non-blank cells.
     */
    public SortedMap<Address, String> getCells() {
        return Collections.unmodifiableSortedMap(cells);
    }

    /**
     * An independent snapshot with the same extents and inputs.
     */
    public Sheet copy() {
        Sheet copy = new Sheet(rowCount, columnCount);
        copy.cells.putAll(cells);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sheet)) {
            return false;
        }
        Sheet sheet = (Sheet) o;
        return rowCount == sheet.rowCount && columnCount == sheet.columnCount && cells.equals(sheet.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, columnCount, cells);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder("Sheet[").append(rowCount).append('x').append(columnCount);
        for (Map.Entry<Address, String> entry : cells.entrySet()) {
            text.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        return text.append(']').toString();
    }
}
