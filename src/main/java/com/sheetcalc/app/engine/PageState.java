package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Everything one evaluation knows about one page: its sheet, its local graph,
 * the cells the static pass found on cycles, and the results computed so far.
 */
final class PageState {
    private final String pageId;
    private final String title;
    private final Sheet sheet;
    private final DependencyGraph graph;
    private final Set<Address> cycleMembers;
    private final Map<Address, CellResult> results = new HashMap<>();

    PageState(String pageId, String title, Sheet sheet, DependencyGraph graph) {
        this.pageId = pageId;
        this.title = title;
        this.sheet = sheet;
        this.graph = graph;
        this.cycleMembers = CycleDetector.findCycleMembers(graph);
    }

    String getPageId() {
        return pageId;
    }

    String getTitle() {
        return title;
    }

    Sheet getSheet() {
        return sheet;
    }

    DependencyGraph getGraph() {
        return graph;
    }

    boolean isOnLocalCycle(Address address) {
        return cycleMembers.contains(address);
    }

    Set<Address> getCycleMembers() {
        return cycleMembers;
    }

    CellResult getResult(Address address) {
        return results.get(address);
    }

    void putResult(CellResult result) {
        results.put(result.getAddress(), result);
    }
}
