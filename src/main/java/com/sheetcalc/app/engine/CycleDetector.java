package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.Address;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds the cells of a sheet that sit on a reference cycle, using the local graph only.
 * Depth-first search with three colours: WHITE (unvisited), GRAY (on the search stack),
 * BLACK (finished). Reaching a GRAY cell again closes a cycle. Low-link bookkeeping on the
 * same walk groups cells into strongly connected components, so a cell is reported exactly
 * when it belongs to a component of two or more cells or reads itself.
 * Cycles through other pages are not visible here; the evaluator catches those while running.
 */
public final class CycleDetector {

    private enum Color { WHITE, GRAY, BLACK }

    private final DependencyGraph graph;
    private final Map<Address, Color> colors = new HashMap<>();
    private final Map<Address, Integer> discovery = new HashMap<>();
    private final Map<Address, Integer> lowLink = new HashMap<>();
    private final Deque<Address> path = new ArrayDeque<>();
    private final SortedSet<Address> members = new TreeSet<>();
    private int counter;

    private CycleDetector(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns every cell on at least one cycle, in row-major order.
     */
    public static SortedSet<Address> findCycleMembers(DependencyGraph graph) {
        CycleDetector detector = new CycleDetector(graph);
        for (Address source : graph.sources()) {
            if (detector.color(source) == Color.WHITE) {
                detector.visit(source);
            }
        }
        return detector.members;
    }

    private Color color(Address address) {
        return colors.getOrDefault(address, Color.WHITE);
    }

    private void visit(Address address) {
        colors.put(address, Color.GRAY);
        discovery.put(address, counter);
        lowLink.put(address, counter);
        counter++;
        path.push(address);

        for (Address next : graph.dependsOn(address)) {
            Color nextColor = color(next);
            if (nextColor == Color.WHITE) {
                visit(next);
                lowLink.put(address, Math.min(lowLink.get(address), lowLink.get(next)));
            } else if (nextColor == Color.GRAY) {
                // Back edge: next is still on the current path
                lowLink.put(address, Math.min(lowLink.get(address), discovery.get(next)));
            }
        }

        if (lowLink.get(address).equals(discovery.get(address))) {
            collectComponent(address);
        }
    }

    private void collectComponent(Address root) {
        SortedSet<Address> component = new TreeSet<>();
        Address member;
        do {
            member = path.pop();
            colors.put(member, Color.BLACK);
            component.add(member);
        } while (!member.equals(root));

        if (component.size() > 1 || graph.dependsOn(root).contains(root)) {
            members.addAll(component);
        }
    }
}
