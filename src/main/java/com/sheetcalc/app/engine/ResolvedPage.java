package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Sheet;

import java.util.Objects;

/**
 * Answer of an {@link ExternalReferenceResolver}: a page id and title plus either its sheet or an error.
 */
public final class ResolvedPage {
    private final String pageId;
    private final String pageTitle;
    private final Sheet sheet;
    private final String error;

    private ResolvedPage(String pageId, String pageTitle, Sheet sheet, String error) {
        this.pageId = pageId;
        this.pageTitle = pageTitle;
        this.sheet = sheet;
        this.error = error;
    }

    public static ResolvedPage found(String pageId, String pageTitle, Sheet sheet) {
        return new ResolvedPage(pageId, pageTitle, Objects.requireNonNull(sheet, "sheet"), null);
    }

    public static ResolvedPage failed(String pageId, String pageTitle, String error) {
        return new ResolvedPage(pageId, pageTitle, null, Objects.requireNonNull(error, "error"));
    }

    public String getPageId() {
        return pageId;
    }

    public String getPageTitle() {
        return pageTitle;
    }

    /**
     * The page's sheet, or null if resolution failed.
     */
    public Sheet getSheet() {
        return sheet;
    }

    public String getError() {
        return error;
    }

    public boolean isFound() {
        return sheet != null && error == null;
    }
}
