package com.sheetcalc.app.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * One sheet of a SheetDoc:
 * - name/order: position among the document's sheets (the lowest order is the primary sheet)
 * - rows/columns: grid extents
 * - cells: address to stored formula or literal, with the last evaluated value
 * - dependencies: address to its local and cross-page edges (informational, rebuilt on load)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SheetDocSheet {

    private String name;
    private Integer order;
    @JsonProperty("row_count")
    private Integer rowCount;
    @JsonProperty("column_count")
    private Integer columnCount;
    private Map<String, SheetDocCell> cells = new TreeMap<>();
    private Map<String, SheetDocDependencies> dependencies = new TreeMap<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getOrder() {
        return order;
    }

    public void setOrder(Integer order) {
        this.order = order;
    }

    public Integer getRowCount() {
        return rowCount;
    }

    public void setRowCount(Integer rowCount) {
        this.rowCount = rowCount;
    }

    public Integer getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(Integer columnCount) {
        this.columnCount = columnCount;
    }

    public Map<String, SheetDocCell> getCells() {
        return cells;
    }

    public void setCells(Map<String, SheetDocCell> cells) {
        this.cells = cells == null ? new TreeMap<>() : new TreeMap<>(cells);
    }

    public Map<String, SheetDocDependencies> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, SheetDocDependencies> dependencies) {
        this.dependencies = dependencies == null ? new TreeMap<>() : new TreeMap<>(dependencies);
    }
}
