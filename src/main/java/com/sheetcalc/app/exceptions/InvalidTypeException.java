package com.sheetcalc.app.exceptions;

import com.sheetcalc.app.engine.ErrorKind;

/**
 * Thrown when an operand can't be coerced to the type an operation needs
 * (e.g., "hello" used in arithmetic). Always a VALUE error.
 */
public class InvalidTypeException extends FormulaEvaluationException {
    public InvalidTypeException(String message) {
        super(ErrorKind.VALUE, message);
    }
}
