package com.sheetcalc.app.models;

import java.util.Objects;

public final class LocalCellReference extends CellReference {
    private final Address address;

    public LocalCellReference(Address address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    public Address getAddress() {
        return address;
    }

    @Override
    public <R> R accept(ReferenceVisitor<R> visitor) {
        return visitor.visitLocal(this);
    }

    @Override
    public boolean isRange() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalCellReference && address.equals(((LocalCellReference) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return address.toString();
    }
}
