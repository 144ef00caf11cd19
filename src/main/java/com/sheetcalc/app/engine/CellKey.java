package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Address;

import java.util.Objects;

/**
 * A cell qualified by the page it lives on; the unit of cycle tracking across sheets.
 */
public final class CellKey {
    private final String pageId;
    private final Address address;

    public CellKey(String pageId, Address address) {
        this.pageId = Objects.requireNonNull(pageId, "pageId");
        this.address = Objects.requireNonNull(address, "address");
    }

    public String getPageId() {
        return pageId;
    }

    public Address getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey cellKey = (CellKey) o;
        return pageId.equals(cellKey.pageId) && address.equals(cellKey.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageId, address);
    }

    @Override
    public String toString() {
        return pageId + "!" + address;
    }
}
