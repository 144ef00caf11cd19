package com.sheetcalc.app.exceptions;

/**
 * Thrown when attempting to access a page ID
 * that doesn't exist in the in-memory page store.
 */
public class PageNotFoundException extends RuntimeException {
    public PageNotFoundException(String message) {
        super(message);
    }
}
