package com.sheetcalc.app.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a SheetDoc: the TOML document that follows the {@code #%SHEETDOC v1} header line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SheetDocument {

    @JsonProperty("page_id")
    private String pageId;
    private List<SheetDocSheet> sheets = new ArrayList<>();

    public String getPageId() {
        return pageId;
    }

    public void setPageId(String pageId) {
        this.pageId = pageId;
    }

    public List<SheetDocSheet> getSheets() {
        return sheets;
    }

    public void setSheets(List<SheetDocSheet> sheets) {
        this.sheets = sheets == null ? new ArrayList<>() : sheets;
    }
}
