package com.sheetcalc.app.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A stored cell. Exactly one of formula or value carries the input; for formula cells
 * value holds the last evaluated result ("" when it failed).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SheetDocCell {

    private String formula;
    private Object value;
    private String type;
    private SheetDocError error;

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public SheetDocError getError() {
        return error;
    }

    public void setError(SheetDocError error) {
        this.error = error;
    }
}
