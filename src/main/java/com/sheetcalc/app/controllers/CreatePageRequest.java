package com.sheetcalc.app.controllers;

/**
 * Body of POST /pages. Every field is optional.
 */
public class CreatePageRequest {

    private String id;
    private String title;
    private Integer rows;
    private Integer columns;

    public CreatePageRequest() {
    }

    public CreatePageRequest(String id, String title, Integer rows, Integer columns) {
        this.id = id;
        this.title = title;
        this.rows = rows;
        this.columns = columns;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getRows() {
        return rows;
    }

    public void setRows(Integer rows) {
        this.rows = rows;
    }

    public Integer getColumns() {
        return columns;
    }

    public void setColumns(Integer columns) {
        this.columns = columns;
    }
}
