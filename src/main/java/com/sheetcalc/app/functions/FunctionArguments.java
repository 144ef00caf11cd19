package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.util.List;

/**
 * The arguments of one function call. Each argument is evaluated at most once, on first access.
 */
public interface FunctionArguments {

    int count();

    /**
     * Scalar value of argument {@code index}. A range argument yields its first cell (blank if empty).
     */
    CellValue get(int index);

    /**
     * Every value of argument {@code index}; a range argument yields all its cells in row-major order.
     */
    List<CellValue> getAll(int index);

    /**
     * All arguments flattened into one list, left to right.
     */
    List<CellValue> flattened();

    default void requireExactly(String name, int expected) {
        if (count() != expected) {
            throw new FormulaEvaluationException(ErrorKind.VALUE,
                    name + " expects exactly " + plural(expected, "argument"));
        }
    }

    default void requireBetween(String name, int min, int max) {
        if (count() < min || count() > max) {
            throw new FormulaEvaluationException(ErrorKind.VALUE,
                    name + " expects " + min + " to " + plural(max, "argument"));
        }
    }

    private static String plural(int n, String noun) {
        return n + " " + (n == 1 ? noun : noun + "s");
    }
}
