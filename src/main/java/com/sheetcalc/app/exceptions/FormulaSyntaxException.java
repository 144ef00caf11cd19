package com.sheetcalc.app.exceptions;

/**
 * Thrown by the tokenizer and parser when formula text is malformed,
 * e.g. "=SUM(A1" or "=@[Sales](sales-1". The parse cache turns it into a PARSE error cell.
 */
public class FormulaSyntaxException extends RuntimeException {
    public FormulaSyntaxException(String message) {
        super(message);
    }
}
