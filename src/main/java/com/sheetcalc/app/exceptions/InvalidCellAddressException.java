package com.sheetcalc.app.exceptions;

/**
 * Thrown when a caller names a cell that isn't a valid A1-style address.
 * For example, "Invalid cell address: "1A". Use A1-style format (e.g., A1, B2, AA100)."
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
