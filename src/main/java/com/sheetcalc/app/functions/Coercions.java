package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.DisplayFormatter;
import com.sheetcalc.app.exceptions.InvalidTypeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Type coercion rules shared by operators and functions.
 */
public final class Coercions {

    /** Plain cell input that is stored as a number rather than text. */
    private static final Pattern NUMBER_LITERAL = Pattern.compile("^-?(?:\\d+\\.?\\d*|\\.\\d+)$");
    /** Text accepted where a number is required. */
    private static final Pattern NUMERIC_TEXT = Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?$");

    private Coercions() {
    }

    public static boolean isNumberLiteral(String trimmedInput) {
        return NUMBER_LITERAL.matcher(trimmedInput).matches();
    }

    /**
     * Blank -> 0, booleans -> 1/0, numeric text -> its number (empty text -> 0).
     * Throws InvalidTypeException for any other text.
     */
    public static double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBoolean() ? 1 : 0;
            case TEXT:
                String trimmed = value.getText().trim();
                if (trimmed.isEmpty()) {
                    return 0;
                }
                if (NUMERIC_TEXT.matcher(trimmed).matches()) {
                    return Double.parseDouble(trimmed);
                }
                throw new InvalidTypeException("Expected a numeric value");
            case ERROR:
                throw new InvalidTypeException(value.getError().getMessage());
            default:
                return 0;
        }
    }

    /**
     * True if {@link #toNumber(CellValue)} would succeed.
     */
    public static boolean isCoercibleToNumber(CellValue value) {
        if (value.isError()) {
            return false;
        }
        if (!value.isText()) {
            return true;
        }
        String trimmed = value.getText().trim();
        return trimmed.isEmpty() || NUMERIC_TEXT.matcher(trimmed).matches();
    }

    /**
     * True for numbers and for non-empty text that reads as a number.
     */
    public static boolean isNumeric(CellValue value) {
        if (value.isNumber()) {
            return true;
        }
        return value.isText() && NUMERIC_TEXT.matcher(value.getText().trim()).matches();
    }

    /**
     * The numeric members of a list, skipping blanks, booleans and non-numeric text.
     */
    public static List<Double> numericMembers(List<CellValue> values) {
        List<Double> numbers = new ArrayList<>();
        for (CellValue value : values) {
            if (isNumeric(value)) {
                numbers.add(toNumber(value));
            }
        }
        return numbers;
    }

    /**
     * Blank -> false, numbers -> non-zero, "TRUE"/"FALSE" text by name, numeric text by value,
     * any other non-empty text -> true.
     */
    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0;
            case TEXT:
                String trimmed = value.getText().trim();
                if (trimmed.isEmpty()) {
                    return false;
                }
                String upper = trimmed.toUpperCase(Locale.ROOT);
                if (upper.equals("TRUE")) {
                    return true;
                }
                if (upper.equals("FALSE")) {
                    return false;
                }
                if (NUMERIC_TEXT.matcher(trimmed).matches()) {
                    return Double.parseDouble(trimmed) != 0;
                }
                return true;
            default:
                return false;
        }
    }

    /**
     * Text form used by concatenation and text functions: the display string, blank -> "".
     */
    public static String toText(CellValue value) {
        return DisplayFormatter.display(value);
    }
}
