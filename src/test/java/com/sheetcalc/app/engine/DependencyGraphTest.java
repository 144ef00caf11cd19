package com.sheetcalc.app.engine;

import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DependencyGraph and CycleDetector.
 */
class DependencyGraphTest {

    private FormulaCache formulas;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        formulas = new FormulaCache(64);
        sheet = new Sheet();
    }

    private DependencyGraph build() {
        return DependencyGraph.build(sheet, formulas, 1000);
    }

    private static Address at(String address) {
        return Address.parse(address);
    }

    /**
     * Ranges expand to one edge per covered cell; reverse edges mirror forward ones.
     */
    @Test
    void testForwardAndReverseEdges() {
        sheet.setCell("A1", "10");
        sheet.setCell("B1", "=SUM(A1:A3)");
        sheet.setCell("C1", "=B1*2+A1");

        DependencyGraph graph = build();
        assertEquals("[A1, A2, A3]", graph.dependsOn(at("B1")).toString());
        assertEquals("[A1, B1]", graph.dependsOn(at("C1")).toString());
        assertEquals("[B1, C1]", graph.dependents(at("A1")).toString());
        assertEquals("[C1]", graph.dependents(at("B1")).toString());
        assertTrue(graph.dependsOn(at("A1")).isEmpty());
    }

    /**
     * Literals and unparseable formulas contribute no edges.
     */
    @Test
    void testLiteralsAndBadFormulasHaveNoEdges() {
        sheet.setCell("A1", "A2");
        sheet.setCell("B1", "=A2+");
        DependencyGraph graph = build();
        assertTrue(graph.getForward().isEmpty());
        assertTrue(graph.getReverse().isEmpty());
    }

    @Test
    void testCrossPageReferencesAreExternalMarkers() {
        sheet.setCell("A1", "=@[Sales](sales-1):B2 + A2");
        DependencyGraph graph = build();
        assertEquals("[A2]", graph.dependsOn(at("A1")).toString());
        SortedSet<ExternalDependency> external = graph.externalDependencies(at("A1"));
        assertEquals(1, external.size());
        assertEquals("sales-1", external.first().getPageKey());
    }

    /**
     * A range wider than the limit only records the non-blank cells it covers.
     */
    @Test
    void testOversizedRangeKeepsOnlyPopulatedCells() {
        sheet.setCell("A5", "1");
        sheet.setCell("B1", "=SUM(A1:A100000)");
        DependencyGraph graph = DependencyGraph.build(sheet, formulas, 10);
        assertEquals("[A5]", graph.dependsOn(at("B1")).toString());
    }

    @Test
    void testTwoCellCycle() {
        sheet.setCell("A1", "=A2");
        sheet.setCell("A2", "=A1");
        sheet.setCell("A3", "=A1");
        assertEquals("[A1, A2]", CycleDetector.findCycleMembers(build()).toString());
    }

    @Test
    void testSelfReferenceIsACycle() {
        sheet.setCell("B2", "=B2+1");
        assertEquals("[B2]", CycleDetector.findCycleMembers(build()).toString());
    }

    /**
     * Only members are reported: cells feeding into or reading from a cycle are not.
     */
    @Test
    void testOnlyCycleMembersAreReported() {
        sheet.setCell("A1", "=A2");
        sheet.setCell("A2", "=A3");
        sheet.setCell("A3", "=A4");
        sheet.setCell("A4", "=A1+B9");
        sheet.setCell("A5", "=A1+1");
        sheet.setCell("C1", "=D1");
        sheet.setCell("D1", "=C1");
        sheet.setCell("E1", "=F1");
        assertEquals("[A1, C1, D1, A2, A3, A4]", CycleDetector.findCycleMembers(build()).toString());
    }

    @Test
    void testAcyclicChain() {
        for (int row = 2; row <= 300; row++) {
            sheet.setCell("A" + row, "=A" + (row - 1) + "+1");
        }
        assertTrue(CycleDetector.findCycleMembers(build()).isEmpty());
    }

    @Test
    void testGraphsOfEqualSheetsAreEqual() {
        sheet.setCell("A1", "=B1+C1");
        assertEquals(build(), DependencyGraph.build(sheet.copy(), new FormulaCache(4), 1000));
    }
}
