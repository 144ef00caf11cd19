package com.sheetcalc.app.engine;

import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.functions.FunctionRegistry;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation of single sheets: values, error kinds, propagation and cycles.
 */
class SheetEvaluatorTest {

    private SheetEvaluator evaluator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        evaluator = new SheetEvaluator();
        sheet = new Sheet();
    }

    private EvaluationResult evaluate() {
        return evaluator.evaluate(sheet);
    }

    private static void assertNumber(double expected, CellResult result) {
        assertNotNull(result);
        assertFalse(result.isError(), () -> "unexpected error: " + result);
        assertEquals(expected, result.getValue().getNumber(), 1e-9);
    }

    /**
     * Revenue/expenses sheet: profits per column and their total.
     */
    @Test
    void testProfitScenario() {
        sheet.setCell("A1", "Revenue");
        sheet.setCell("B1", "1000");
        sheet.setCell("C1", "1500");
        sheet.setCell("A2", "Expenses");
        sheet.setCell("B2", "600");
        sheet.setCell("C2", "800");
        sheet.setCell("A3", "Profit");
        sheet.setCell("B3", "=B1-B2");
        sheet.setCell("C3", "=C1-C2");
        sheet.setCell("A4", "Total Profit");
        sheet.setCell("B4", "=B3+C3");

        EvaluationResult result = evaluate();
        assertNumber(400, result.get("B3"));
        assertNumber(700, result.get("C3"));
        assertNumber(1100, result.get("B4"));
        assertEquals("1100", result.get("B4").getDisplay());
        assertEquals("Revenue", result.get("A1").getDisplay());
        assertEquals(11, result.getByAddress().size());
    }

    @Test
    void testLiteralCells() {
        sheet.setCell("A1", " 42 ");
        sheet.setCell("A2", "-.5");
        sheet.setCell("A3", "12abc");
        sheet.setCell("A4", "TRUE");

        EvaluationResult result = evaluate();
        assertNumber(42, result.get("A1"));
        assertEquals(" 42 ", result.get("A1").getRaw());
        assertNumber(-0.5, result.get("A2"));
        assertTrue(result.get("A3").getValue().isText());
        // Plain input is never a boolean
        assertEquals("TRUE", result.get("A4").getValue().getText());
    }

    /**
     * Blank cells read as zero in arithmetic.
     */
    @Test
    void testBlankAsZero() {
        sheet.setCell("A1", "=A2+10");
        assertNumber(10, evaluate().get("A1"));
    }

    @Test
    void testDivisionByZero() {
        sheet.setCell("A1", "10");
        sheet.setCell("A2", "0");
        sheet.setCell("A3", "=A1/A2");

        CellResult a3 = evaluate().get("A3");
        assertEquals(ErrorKind.DIV0, a3.getErrorKind());
        assertEquals("Division by zero", a3.getErrorMessage());
        assertEquals("#ERROR", a3.getDisplay());
    }

    @Test
    void testTwoCellCycle() {
        sheet.setCell("A1", "=A2");
        sheet.setCell("A2", "=A1");

        EvaluationResult result = evaluate();
        assertEquals(ErrorKind.CIRCULAR, result.get("A1").getErrorKind());
        assertEquals(ErrorKind.CIRCULAR, result.get("A2").getErrorKind());
        assertEquals(CellError.CIRCULAR_MESSAGE, result.get("A1").getErrorMessage());
    }

    /**
     * Every member of a four-cell loop is CIRCULAR; a cell merely reading the loop is PROPAGATED.
     */
    @Test
    void testTransitiveCycleAndDependent() {
        sheet.setCell("A1", "=A2");
        sheet.setCell("A2", "=A3");
        sheet.setCell("A3", "=A4");
        sheet.setCell("A4", "=A1");
        sheet.setCell("A5", "=A1+1");

        EvaluationResult result = evaluate();
        for (String member : new String[]{"A1", "A2", "A3", "A4"}) {
            assertEquals(ErrorKind.CIRCULAR, result.get(member).getErrorKind(), member);
        }
        CellResult a5 = result.get("A5");
        assertEquals(ErrorKind.PROPAGATED, a5.getErrorKind());
        assertEquals(ErrorKind.CIRCULAR, a5.getError().getRootKind());
        assertEquals("#CYCLE!", a5.getError().getToken());
    }

    @Test
    void testSelfReference() {
        sheet.setCell("C3", "=C3*2");
        assertEquals(ErrorKind.CIRCULAR, evaluate().get("C3").getErrorKind());
    }

    /**
     * A cycle through an IF branch is reported even when the branch isn't taken.
     */
    @Test
    void testGuardedCycleIsStillCircular() {
        sheet.setCell("A1", "=IF(FALSE, A2, 1)");
        sheet.setCell("A2", "=A1");
        EvaluationResult result = evaluate();
        assertEquals(ErrorKind.CIRCULAR, result.get("A1").getErrorKind());
        assertEquals(ErrorKind.CIRCULAR, result.get("A2").getErrorKind());
    }

    /**
     * Reading a failed cell carries the root message along; the reader's own failures keep their kind.
     */
    @Test
    void testErrorPropagation() {
        sheet.setCell("A1", "=1/0");
        sheet.setCell("A2", "=A1+1");
        sheet.setCell("A3", "=SUM(A1:A2)");
        sheet.setCell("A4", "=\"x\"*2");

        EvaluationResult result = evaluate();
        CellResult a2 = result.get("A2");
        assertEquals(ErrorKind.PROPAGATED, a2.getErrorKind());
        assertEquals(ErrorKind.DIV0, a2.getError().getRootKind());
        assertEquals("Division by zero", a2.getErrorMessage());
        assertEquals(ErrorKind.PROPAGATED, result.get("A3").getErrorKind());
        assertEquals(ErrorKind.VALUE, result.get("A4").getErrorKind());
        assertEquals("Expected a numeric value", result.get("A4").getErrorMessage());
    }

    /**
     * A parse error stays in its cell; unrelated cells evaluate normally.
     */
    @Test
    void testParseErrorIsLocal() {
        sheet.setCell("A1", "=1+");
        sheet.setCell("A2", "=(2+3");
        sheet.setCell("B1", "=2*3");

        EvaluationResult result = evaluate();
        assertEquals(ErrorKind.PARSE, result.get("A1").getErrorKind());
        assertEquals(ErrorKind.PARSE, result.get("A2").getErrorKind());
        assertEquals("#ERROR", result.get("A1").getDisplay());
        assertNumber(6, result.get("B1"));
    }

    /**
     * A formula nested thousands of levels deep is a PARSE error in its own cell only.
     */
    @Test
    void testDeeplyNestedFormulaIsLocal() {
        sheet.setCell("A1", "=" + "(".repeat(5000) + "1" + ")".repeat(5000));
        sheet.setCell("A2", "=-" + "-".repeat(5000) + "1");
        sheet.setCell("A3", "=" + "(".repeat(100) + "7" + ")".repeat(100));
        sheet.setCell("B1", "5");
        sheet.setCell("B2", "=B1*2");
        sheet.setCell("B3", "=A1+1");

        EvaluationResult result = evaluate();
        assertEquals(ErrorKind.PARSE, result.get("A1").getErrorKind());
        assertEquals("Formula is nested too deeply", result.get("A1").getErrorMessage());
        assertEquals(ErrorKind.PARSE, result.get("A2").getErrorKind());
        assertNumber(7, result.get("A3"));
        assertNumber(5, result.get("B1"));
        assertNumber(10, result.get("B2"));
        assertEquals(ErrorKind.PROPAGATED, result.get("B3").getErrorKind());
    }

    @Test
    void testAggregates() {
        sheet.setCell("A1", "10");
        sheet.setCell("A2", "20");
        sheet.setCell("A3", "30");
        sheet.setCell("B1", "=SUM(A1:A3)");
        sheet.setCell("B2", "=AVERAGE(A1:A3)");
        sheet.setCell("B3", "=AVERAGE(C1:C3)");
        sheet.setCell("B4", "=MAX(A1:A3, 45) - MIN(A1:A3)");

        EvaluationResult result = evaluate();
        assertNumber(60, result.get("B1"));
        assertNumber(20, result.get("B2"));
        assertEquals(ErrorKind.DIV0, result.get("B3").getErrorKind());
        assertNumber(35, result.get("B4"));
    }

    /**
     * IF only evaluates the selected branch: the failing branch is never reached.
     */
    @Test
    void testIfIsLazy() {
        sheet.setCell("B1", "60");
        sheet.setCell("B2", "7");
        sheet.setCell("B3", "=1/0");
        sheet.setCell("C1", "=IF(B1>50, B2, 0/0)");
        sheet.setCell("C2", "=IF(B1>50, B2, B3)");
        sheet.setCell("C3", "=IF(B1<50, B2)");

        EvaluationResult result = evaluate();
        assertNumber(7, result.get("C1"));
        assertNumber(7, result.get("C2"));
        assertTrue(result.get("C3").getValue().isBlank());
    }

    @Test
    void testComparisonAndConcatenation() {
        sheet.setCell("A1", "5");
        sheet.setCell("B1", "=A1=\"5\"");
        sheet.setCell("B2", "=\"abc\"=\"ABC\"");
        sheet.setCell("B3", "=A1<>4");
        sheet.setCell("B4", "=\"Total: \"&A1*2");
        sheet.setCell("B5", "=\"a\"<1");

        EvaluationResult result = evaluate();
        assertTrue(result.get("B1").getValue().getBoolean());
        assertFalse(result.get("B2").getValue().getBoolean());
        assertTrue(result.get("B3").getValue().getBoolean());
        assertEquals("true", result.get("B3").getDisplay());
        assertEquals("Total: 10", result.get("B4").getDisplay());
        assertEquals(ErrorKind.VALUE, result.get("B5").getErrorKind());
    }

    @Test
    void testUnknownFunction() {
        sheet.setCell("A1", "=FROB(1)");
        CellResult a1 = evaluate().get("A1");
        assertEquals(ErrorKind.VALUE, a1.getErrorKind());
        assertEquals("Unknown function FROB", a1.getErrorMessage());
    }

    @Test
    void testNonFiniteResult() {
        sheet.setCell("A1", "=10^400");
        CellResult a1 = evaluate().get("A1");
        assertEquals(ErrorKind.VALUE, a1.getErrorKind());
        assertEquals("Result is not a finite number", a1.getErrorMessage());
    }

    @Test
    void testRangeLimit() {
        SheetEvaluator limited = new SheetEvaluator(new FormulaCache(16),
                FunctionRegistry.withDefaults(Clock.systemUTC()), 10);
        sheet.setCell("A1", "=SUM(B1:B11)");
        sheet.setCell("A2", "=SUM(B1:B10)");

        EvaluationResult result = limited.evaluate(sheet);
        assertEquals(ErrorKind.VALUE, result.get("A1").getErrorKind());
        assertEquals("Range is too large", result.get("A1").getErrorMessage());
        assertNumber(0, result.get("A2"));
    }

    /**
     * A range used where one value is expected takes its first cell.
     */
    @Test
    void testRangeAsScalar() {
        sheet.setCell("A1", "3");
        sheet.setCell("A2", "4");
        sheet.setCell("B1", "=A1:A2*2");
        assertNumber(6, evaluate().get("B1"));
    }

    @Test
    void testDeepChain() {
        sheet.setCell("A1", "1");
        for (int row = 2; row <= 400; row++) {
            sheet.setCell("A" + row, "=A" + (row - 1) + "+1");
        }
        assertNumber(400, evaluate().get("A400"));
    }

    /**
     * Evaluation is pure: same sheet, same result, and the sheet is left untouched.
     */
    @Test
    void testEvaluationIsRepeatable() {
        sheet.setCell("A1", "=A2");
        sheet.setCell("A2", "=A1");
        sheet.setCell("B1", "=SUM(C1:C3)/0");
        sheet.setCell("C1", "2");
        sheet.setCell("D1", "=UPPER(\"x\")&C1");
        Sheet before = sheet.copy();

        EvaluationResult first = evaluate();
        EvaluationResult second = evaluate();
        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
        assertEquals(before, sheet);
    }

    @Test
    void testDependenciesAreReported() {
        sheet.setCell("A1", "1");
        sheet.setCell("B1", "=A1*2");
        EvaluationResult result = evaluate();
        assertEquals("[A1]", result.getDependencies().dependsOn(Address.parse("B1")).toString());
    }
}
