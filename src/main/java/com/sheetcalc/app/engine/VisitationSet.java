package com.sheetcalc.app.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The cells currently being evaluated, in the order evaluation entered them.
 * One instance is shared by the whole recursive call tree of a single evaluation,
 * across every sheet it reaches. Not thread-safe.
 */
final class VisitationSet {

    private final List<CellKey> path = new ArrayList<>();
    private final Set<CellKey> members = new HashSet<>();

    boolean contains(CellKey key) {
        return members.contains(key);
    }

    void push(CellKey key) {
        path.add(key);
        members.add(key);
    }

    void pop(CellKey key) {
        CellKey top = path.remove(path.size() - 1);
        if (!top.equals(key)) {
            throw new IllegalStateException("Visitation out of order: expected " + key + " but found " + top);
        }
        members.remove(key);
    }

    /**
     * The entries from {@code key} (inclusive) up to the top: the cells forming the cycle
     * that re-entering {@code key} closes.
     */
    List<CellKey> cycleFrom(CellKey key) {
        int start = path.indexOf(key);
        return new ArrayList<>(path.subList(start, path.size()));
    }
}
