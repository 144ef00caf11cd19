package com.sheetcalc.app.exceptions;

import com.sheetcalc.app.engine.ErrorKind;

/**
 * Thrown by operators and functions when a well-formed formula cannot produce a value
 * (division by zero, a bad argument count, ...). The evaluator converts it into an error
 * value of the carried kind; it never escapes an evaluation call.
 */
public class FormulaEvaluationException extends RuntimeException {
    private final ErrorKind kind;

    public FormulaEvaluationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
