package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Address;

import java.util.Objects;

/**
 * The outcome of evaluating one cell:
 * - raw: the cell's input exactly as stored in the sheet
 * - value: the computed value (an error value for error cells)
 * - display: always populated; "#ERROR" for error cells
 * - error: null unless the cell failed
 */
public final class CellResult {
    private final Address address;
    private final String raw;
    private final CellValue value;
    private final String display;

    public CellResult(Address address, String raw, CellValue value) {
        this.address = Objects.requireNonNull(address, "address");
        this.raw = raw == null ? "" : raw;
        this.value = Objects.requireNonNull(value, "value");
        this.display = DisplayFormatter.display(value);
    }

    public Address getAddress() {
        return address;
    }

    public String getRaw() {
        return raw;
    }

    public CellValue getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public boolean isError() {
        return value.isError();
    }

    public CellError getError() {
        return value.getError();
    }

    public ErrorKind getErrorKind() {
        return value.isError() ? value.getError().getKind() : null;
    }

    public String getErrorMessage() {
        return value.isError() ? value.getError().getMessage() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellResult)) {
            return false;
        }
        CellResult that = (CellResult) o;
        return address.equals(that.address) && raw.equals(that.raw) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, raw, value);
    }

    @Override
    public String toString() {
        return address + "=" + (isError() ? display + " (" + value.getError() + ")" : display);
    }
}
