package com.sheetcalc.app.controllers;

/**
 * One entry of a batch cell update: an A1-style address and its new raw input.
 */
public class CellUpdate {

    private String address;
    private String value;

    public CellUpdate() {
    }

    public CellUpdate(String address, String value) {
        this.address = address;
        this.value = value;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
