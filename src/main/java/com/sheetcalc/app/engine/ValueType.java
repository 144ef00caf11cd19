package com.sheetcalc.app.engine;

public enum ValueType {
    BLANK("empty"),
    NUMBER("number"),
    TEXT("string"),
    BOOLEAN("boolean"),
    ERROR("error");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    /**
     * Lower-case name used in serialized output.
     */
    public String getLabel() {
        return label;
    }
}
