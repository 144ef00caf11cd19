package com.sheetcalc.app.models;

import java.util.Locale;
import java.util.Objects;

/**
 * Represents a single cell coordinate in a sheet.
 * Stores:
 * - row (zero-based, so "A1" has row 0)
 * - column (zero-based, so "A1" has column 0)
 * The canonical text form is spreadsheet-style: column letters followed by the 1-based row.
 */
public final class Address implements Comparable<Address> {

    // Keeps parsed coordinates well inside int range
    private static final int MAX_COLUMN_LETTERS = 6;
    private static final int MAX_ROW_DIGITS = 9;

    private final int row;
    private final int column;

    public Address(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Row and column indices must be non-negative");
        }
        this.row = row;
        this.column = column;
    }

    /**
     * Parses text like "B12" (case-insensitive, surrounding whitespace ignored).
     * Throws IllegalArgumentException if the text is not a cell address.
     */
    public static Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Invalid cell reference: null");
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        int split = 0;
        while (split < upper.length() && upper.charAt(split) >= 'A' && upper.charAt(split) <= 'Z') {
            split++;
        }
        String letters = upper.substring(0, split);
        String digits = upper.substring(split);
        if (letters.isEmpty() || digits.isEmpty() || letters.length() > MAX_COLUMN_LETTERS
                || digits.length() > MAX_ROW_DIGITS || !digits.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Invalid cell reference: " + text);
        }

        int column = 0;
        for (int i = 0; i < letters.length(); i++) {
            column = column * 26 + (letters.charAt(i) - 'A' + 1);
        }
        int row = Integer.parseInt(digits);
        if (row < 1) {
            throw new IllegalArgumentException("Invalid cell reference: " + text);
        }
        return new Address(row - 1, column - 1);
    }

    /**
     * Returns true if the text parses as a cell address.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Converts a zero-based column index to its letters: 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnName(int column) {
        StringBuilder name = new StringBuilder();
        int index = column;
        while (index >= 0) {
            name.insert(0, (char) ('A' + index % 26));
            index = index / 26 - 1;
        }
        return name.toString();
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int compareTo(Address other) {
        // Row-major: all of row 1 before any of row 2
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Address)) {
            return false;
        }
        Address address = (Address) o;
        return row == address.row && column == address.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return columnName(column) + (row + 1);
    }
}
