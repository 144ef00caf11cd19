package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;

/**
 * A named spreadsheet function such as SUM or IF.
 * Eager functions (the default) only run once every argument has been evaluated without error;
 * the first error among the flattened arguments is returned in their place.
 * Lazy functions pull arguments on demand and see errors themselves.
 * Failures are signalled by throwing FormulaEvaluationException.
 */
@FunctionalInterface
public interface SheetFunction {

    CellValue apply(FunctionArguments args);

    default boolean isLazy() {
        return false;
    }
}
