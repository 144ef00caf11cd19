package com.sheetcalc.app.exceptions;

/**
 * Thrown when serialized sheet text (the line form or a SheetDoc) can't be read back.
 */
public class SheetFormatException extends RuntimeException {
    public SheetFormatException(String message) {
        super(message);
    }

    public SheetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
