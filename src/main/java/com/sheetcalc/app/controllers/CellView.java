package com.sheetcalc.app.controllers;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sheetcalc.app.engine.CellResult;

/**
 * JSON shape of one evaluated cell:
 * - raw: the stored input
 * - value: number, string or boolean (null for errors)
 * - display: the rendered value, "#ERROR" for errors
 * - type: "number", "string", "boolean", "empty" or "error"
 * - error/errorKind/errorToken: only present for error cells
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {

    private final String raw;
    private final Object value;
    private final String display;
    private final String type;
    private final String error;
    private final String errorKind;
    private final String errorToken;

    private CellView(String raw, Object value, String display, String type,
                     String error, String errorKind, String errorToken) {
        this.raw = raw;
        this.value = value;
        this.display = display;
        this.type = type;
        this.error = error;
        this.errorKind = errorKind;
        this.errorToken = errorToken;
    }

    public static CellView from(CellResult result) {
        if (result.isError()) {
            return new CellView(result.getRaw(), null, result.getDisplay(), result.getValue().getType().getLabel(),
                    result.getErrorMessage(), result.getErrorKind().name(), result.getError().getToken());
        }
        return new CellView(result.getRaw(), result.getValue().toJavaValue(), result.getDisplay(),
                result.getValue().getType().getLabel(), null, null, null);
    }

    public String getRaw() {
        return raw;
    }

    public Object getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public String getType() {
        return type;
    }

    public String getError() {
        return error;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getErrorToken() {
        return errorToken;
    }
}
