package com.sheetcalc.app.exceptions;

/**
 * Body returned by the REST layer when a request fails.
 * For example:
 * {
 *   "code": "PAGE_NOT_FOUND",
 *   "message": "Page not found: page-7"
 * }
 * Formula problems are not reported this way: they become error cells in the evaluation.
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
