package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellResult;
import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.engine.SheetEvaluator;
import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Built-in functions, evaluated through formulas with a fixed clock.
 */
class FunctionLibraryTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);

    private SheetEvaluator evaluator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        evaluator = new SheetEvaluator(new FormulaCache(64), FunctionRegistry.withDefaults(FIXED_CLOCK), 1000);
        sheet = new Sheet();
        sheet.setCell("A1", "10");
        sheet.setCell("A2", "20");
        sheet.setCell("A3", "abc");
        sheet.setCell("A4", "30");
    }

    private CellResult eval(String formula) {
        sheet.setCell("Z1", formula);
        EvaluationResult result = evaluator.evaluate(sheet);
        return result.get("Z1");
    }

    private double number(String formula) {
        CellResult result = eval(formula);
        assertFalse(result.isError(), () -> formula + " -> " + result);
        return result.getValue().getNumber();
    }

    private String display(String formula) {
        return eval(formula).getDisplay();
    }

    /**
     * Non-numeric members are skipped by the numeric aggregates and counted by COUNTA.
     */
    @Test
    void testAggregates() {
        assertEquals(60, number("=SUM(A1:A4)"));
        assertEquals(20, number("=AVERAGE(A1:A4)"));
        assertEquals(20, number("=AVG(A1, A2, A4)"));
        assertEquals(10, number("=MIN(A1:A4)"));
        assertEquals(30, number("=MAX(A1:A4)"));
        assertEquals(3, number("=COUNT(A1:A5)"));
        assertEquals(4, number("=COUNTA(A1:A5)"));
        assertEquals(0, number("=MAX(B1:B3)"));
        assertEquals(ErrorKind.DIV0, eval("=AVERAGE(A3)").getErrorKind());
    }

    @Test
    void testMath() {
        assertEquals(3.5, number("=ABS(-3.5)"));
        assertEquals(2.35, number("=ROUND(2.345, 2)"), 1e-12);
        assertEquals(-3, number("=ROUND(-2.5)"));
        assertEquals(10, number("=FLOOR(12, 5)"));
        assertEquals(15, number("=CEILING(12, 5)"));
        assertEquals(-4, number("=INT(-3.2)"));
        assertEquals(-1, number("=SIGN(-8)"));
        assertEquals(4, number("=SQRT(16)"));
        assertEquals(8, number("=POWER(2, 3)"));
        assertEquals(1, number("=MOD(10, 3)"));
        assertEquals(Math.PI, number("=PI()"));

        assertEquals(1200, number("=ROUND(1234.5, -2)"));
        assertEquals(ErrorKind.DIV0, eval("=MOD(1, 0)").getErrorKind());
        assertEquals(ErrorKind.VALUE, eval("=SQRT(-1)").getErrorKind());
        assertEquals(ErrorKind.VALUE, eval("=ABS(A3)").getErrorKind());
    }

    /**
     * Digit counts beyond what a double can hold are answered without scaling.
     */
    @Test
    void testRoundWithExtremeDigits() {
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertEquals(1.5, number("=ROUND(1.5, 2000000)"));
            assertEquals(0, number("=ROUND(1.5, -2000000)"));
            assertEquals(1.5, number("=ROUND(1.5, 2147483647)"));
            assertEquals(0.1, number("=ROUND(0.1, 340)"));
        });
    }

    /**
     * Wrong argument counts are VALUE errors that name the function.
     */
    @Test
    void testArityErrors() {
        CellResult result = eval("=ABS(1, 2)");
        assertEquals(ErrorKind.VALUE, result.getErrorKind());
        assertEquals("ABS expects exactly 1 argument", result.getErrorMessage());
        assertEquals(ErrorKind.VALUE, eval("=IF(TRUE)").getErrorKind());
        assertEquals(ErrorKind.VALUE, eval("=MID(\"abc\", 1)").getErrorKind());
    }

    @Test
    void testLogical() {
        assertEquals("yes", display("=IF(A1>5, \"yes\", \"no\")"));
        assertEquals("true", display("=AND(TRUE, A1>5)"));
        assertEquals("false", display("=AND(TRUE, 0)"));
        assertEquals("true", display("=OR(FALSE, 1)"));
        assertEquals("false", display("=NOT(TRUE)"));
        assertEquals("true", display("=ISBLANK(B9)"));
        assertEquals("true", display("=ISNUMBER(A1)"));
        assertEquals("false", display("=ISNUMBER(A3)"));
        assertEquals("true", display("=ISTEXT(A3)"));
    }

    /**
     * IFERROR swaps a failed first argument for its fallback; the fallback isn't touched otherwise.
     */
    @Test
    void testIfError() {
        assertEquals(0, number("=IFERROR(1/0, 0)"));
        assertEquals(10, number("=IFERROR(A1, 1/0)"));
        sheet.setCell("B1", "=1/0");
        assertEquals(-1, number("=IFERROR(B1 * 2, -1)"));
    }

    /**
     * Eager functions never see an error argument: the first one is returned instead.
     */
    @Test
    void testErrorArgumentsShortCircuit() {
        sheet.setCell("B1", "=1/0");
        CellResult result = eval("=SUM(A1, B1, \"x\"*1)");
        assertEquals(ErrorKind.PROPAGATED, result.getErrorKind());
        assertEquals(ErrorKind.DIV0, result.getError().getRootKind());
    }

    @Test
    void testText() {
        assertEquals("10-abc", display("=CONCAT(A1, \"-\", A3)"));
        assertEquals("1020", display("=CONCATENATE(A1:A2)"));
        assertEquals("ABC", display("=UPPER(A3)"));
        assertEquals("mixed", display("=LOWER(\"MiXeD\")"));
        assertEquals("a b", display("=TRIM(\"  a b  \")"));
        assertEquals(3, number("=LEN(A3)"));
        assertEquals("ab", display("=LEFT(A3, 2)"));
        assertEquals("c", display("=RIGHT(A3)"));
        assertEquals("bc", display("=MID(A3, 2, 5)"));
        assertEquals("a-b-c", display("=SUBSTITUTE(\"a b c\", \" \", \"-\")"));
        assertEquals("a b-c", display("=SUBSTITUTE(\"a b c\", \" \", \"-\", 2)"));
        assertEquals("xyxyxy", display("=REPT(\"xy\", 3)"));
        assertEquals(2, number("=FIND(\"b\", A3)"));
        assertEquals(2, number("=SEARCH(\"B\", A3)"));
        assertEquals(ErrorKind.VALUE, eval("=FIND(\"B\", A3)").getErrorKind());
    }

    /**
     * Date functions read the registry's clock, so results are fixed here.
     */
    @Test
    void testDates() {
        assertEquals("2024-03-15", display("=TODAY()"));
        assertEquals("2024-03-15T10:30:00Z", display("=NOW()"));
        assertEquals(2024, number("=YEAR(TODAY())"));
        assertEquals(3, number("=MONTH(\"2024-03-15\")"));
        assertEquals(31, number("=DAY(\"2023-12-31T23:59:00\")"));
        assertEquals(ErrorKind.VALUE, eval("=YEAR(\"not a date\")").getErrorKind());
    }

    @Test
    void testCustomFunctionRegistration() {
        FunctionRegistry registry = FunctionRegistry.withDefaults(FIXED_CLOCK);
        registry.register("double", args -> {
            args.requireExactly("DOUBLE", 1);
            return CellValue.number(Coercions.toNumber(args.get(0)) * 2);
        });
        SheetEvaluator custom = new SheetEvaluator(new FormulaCache(8), registry, 1000);
        sheet.setCell("Z1", "=Double(A1)");

        assertEquals(20, custom.evaluate(sheet).get("Z1").getValue().getNumber());
        assertTrue(registry.lookup("DOUBLE").isPresent());
        assertTrue(registry.names().contains("SUM"));
    }
}
