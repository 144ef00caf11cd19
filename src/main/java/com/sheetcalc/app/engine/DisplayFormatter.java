package com.sheetcalc.app.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Canonical display strings for cell values.
 * Numbers show at most 12 significant digits with trailing zeros dropped ("400", "0.3", "0.333333333333").
 */
public final class DisplayFormatter {

    /** Display of every error cell, distinct from any number, text or boolean display. */
    public static final String ERROR_DISPLAY = "#ERROR";

    private static final MathContext DISPLAY_PRECISION = new MathContext(12, RoundingMode.HALF_UP);
    private static final double MAX_EXACT_INTEGER = 1e15;

    private DisplayFormatter() {
    }

    public static String display(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return formatNumber(value.getNumber());
            case TEXT:
                return value.getText();
            case BOOLEAN:
                return value.getBoolean() ? "true" : "false";
            case ERROR:
                return ERROR_DISPLAY;
            default:
                return "";
        }
    }

    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return ERROR_DISPLAY;
        }
        if (value == 0) {
            return "0";
        }
        double abs = Math.abs(value);
        if (value == Math.rint(value) && abs < MAX_EXACT_INTEGER) {
            return Long.toString((long) value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).round(DISPLAY_PRECISION).stripTrailingZeros();
        if (abs >= 1e21 || abs < 1e-7) {
            return rounded.toString();
        }
        return rounded.toPlainString();
    }
}
