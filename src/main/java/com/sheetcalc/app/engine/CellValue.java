package com.sheetcalc.app.engine;

import java.util.Objects;

/**
 * The value of an evaluated cell or sub-expression: blank, number, text, boolean or error.
 * Immutable.
 */
public final class CellValue {

    private static final CellValue BLANK = new CellValue(ValueType.BLANK, 0, null, false, null);
    private static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, 0, null, true, null);
    private static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, 0, null, false, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final CellError error;

    private CellValue(ValueType type, double number, String text, boolean bool, CellError error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue blank() {
        return BLANK;
    }

    public static CellValue number(double value) {
        // -0.0 and 0.0 must compare and display the same
        return new CellValue(ValueType.NUMBER, value == 0 ? 0.0 : value, null, false, null);
    }

    public static CellValue text(String value) {
        return new CellValue(ValueType.TEXT, 0, Objects.requireNonNull(value, "value"), false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(CellError error) {
        return new CellValue(ValueType.ERROR, 0, null, false, Objects.requireNonNull(error, "error"));
    }

    public static CellValue error(ErrorKind kind, String message) {
        return error(CellError.of(kind, message));
    }

    public ValueType getType() {
        return type;
    }

    public boolean isBlank() {
        return type == ValueType.BLANK;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBoolean() {
        return bool;
    }

    public CellError getError() {
        return error;
    }

    /**
     * The plain Java value: null, Double, String, Boolean, or the CellError.
     */
    public Object toJavaValue() {
        switch (type) {
            case NUMBER:
                return number;
            case TEXT:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return type == that.type
                && Double.compare(number, that.number) == 0
                && bool == that.bool
                && Objects.equals(text, that.text)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        return type == ValueType.ERROR ? error.toString() : type + "(" + DisplayFormatter.display(this) + ")";
    }
}
