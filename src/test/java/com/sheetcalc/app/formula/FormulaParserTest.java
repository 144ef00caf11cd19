package com.sheetcalc.app.formula;

import com.sheetcalc.app.exceptions.FormulaSyntaxException;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.CrossPageReference;
import com.sheetcalc.app.models.LocalCellReference;
import com.sheetcalc.app.models.LocalRangeReference;
import com.sheetcalc.app.models.Range;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FormulaParser: precedence, references and syntax errors.
 */
class FormulaParserTest {

    private static Expression cell(String address) {
        return new ReferenceExpression(new LocalCellReference(Address.parse(address)));
    }

    /**
     * Multiplication binds tighter than addition: 1+2*3 is 1+(2*3).
     */
    @Test
    void testMultiplicationBeforeAddition() {
        Expression expected = new BinaryExpression(BinaryOperator.ADD,
                new NumberLiteral(1),
                new BinaryExpression(BinaryOperator.MULTIPLY, new NumberLiteral(2), new NumberLiteral(3)));
        assertEquals(expected, FormulaParser.parse("1+2*3"));
    }

    @Test
    void testLeftAssociativity() {
        Expression expected = new BinaryExpression(BinaryOperator.SUBTRACT,
                new BinaryExpression(BinaryOperator.SUBTRACT, new NumberLiteral(10), new NumberLiteral(4)),
                new NumberLiteral(3));
        assertEquals(expected, FormulaParser.parse("10-4-3"));
    }

    /**
     * Comparison is loosest, then concatenation, then arithmetic.
     */
    @Test
    void testComparisonAndConcatenationPrecedence() {
        Expression expected = new BinaryExpression(BinaryOperator.EQUAL,
                new BinaryExpression(BinaryOperator.CONCAT,
                        cell("A1"),
                        new BinaryExpression(BinaryOperator.ADD, new NumberLiteral(1), new NumberLiteral(2))),
                new StringLiteral("x3"));
        assertEquals(expected, FormulaParser.parse("A1 & 1 + 2 = \"x3\""));
    }

    @Test
    void testExponentAndUnaryMinus() {
        Expression expected = new BinaryExpression(BinaryOperator.MULTIPLY,
                new UnaryExpression(UnaryOperator.NEGATE, cell("A1")),
                new BinaryExpression(BinaryOperator.POWER, new NumberLiteral(2), new NumberLiteral(3)));
        assertEquals(expected, FormulaParser.parse("-A1*2^3"));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        Expression expected = new BinaryExpression(BinaryOperator.MULTIPLY,
                new BinaryExpression(BinaryOperator.ADD, new NumberLiteral(1), new NumberLiteral(2)),
                new NumberLiteral(3));
        assertEquals(expected, FormulaParser.parse("(1+2)*3"));
    }

    @Test
    void testFunctionCallWithRangeAndNestedCall() {
        Expression parsed = FormulaParser.parse("sum(A1:B2, max(1, 2), TRUE)");
        FunctionCall call = assertInstanceOf(FunctionCall.class, parsed);
        assertEquals("SUM", call.getName());
        List<Expression> arguments = call.getArguments();
        assertEquals(3, arguments.size());
        assertEquals(new ReferenceExpression(new LocalRangeReference(Range.parse("A1:B2"))), arguments.get(0));
        assertEquals("MAX", ((FunctionCall) arguments.get(1)).getName());
        assertEquals(new BooleanLiteral(true), arguments.get(2));

        FunctionCall empty = assertInstanceOf(FunctionCall.class, FormulaParser.parse("PI()"));
        assertTrue(empty.getArguments().isEmpty());
    }

    @Test
    void testCrossPageReferences() {
        ReferenceExpression single = assertInstanceOf(ReferenceExpression.class,
                FormulaParser.parse("@[Sales](sales-1):B2"));
        CrossPageReference cellRef = assertInstanceOf(CrossPageReference.class, single.getReference());
        assertEquals("sales-1", cellRef.getPage().getIdentifier());
        assertEquals(Address.parse("B2"), cellRef.getAddress());
        assertFalse(cellRef.isRange());

        ReferenceExpression range = (ReferenceExpression) FormulaParser.parse("@[Sales](sales-1):A1:B3");
        CrossPageReference rangeRef = (CrossPageReference) range.getReference();
        assertTrue(rangeRef.isRange());
        assertEquals(Range.parse("A1:B3"), rangeRef.getRange());

        ReferenceExpression whole = (ReferenceExpression) FormulaParser.parse("@[Sales](sales-1)");
        assertTrue(((CrossPageReference) whole.getReference()).isWholeSheet());
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(""));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("1+"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("(1+2"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("1+2)"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("SUM(1,2"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("FOO"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("A1:5"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("@[Sales](s):"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("1 2"));
    }

    @Test
    void testErrorMessages() {
        FormulaSyntaxException empty = assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("  "));
        assertEquals("Empty formula", empty.getMessage());

        FormulaSyntaxException trailing = assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("1 2"));
        assertEquals("Unexpected tokens after end of formula", trailing.getMessage());
    }

    /**
     * Nesting is bounded so that pathological input fails as a syntax error instead of exhausting the stack.
     */
    @Test
    void testNestingLimits() {
        int limit = FormulaParser.MAX_NESTING_DEPTH;
        assertInstanceOf(NumberLiteral.class, FormulaParser.parse("(".repeat(limit) + "1" + ")".repeat(limit)));
        assertInstanceOf(UnaryExpression.class, FormulaParser.parse("-".repeat(limit) + "1"));

        FormulaSyntaxException parens = assertThrows(FormulaSyntaxException.class, () ->
                FormulaParser.parse("(".repeat(5000) + "1" + ")".repeat(5000)));
        assertEquals("Formula is nested too deeply", parens.getMessage());
        assertThrows(FormulaSyntaxException.class, () ->
                FormulaParser.parse("(".repeat(limit + 1) + "1" + ")".repeat(limit + 1)));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("-".repeat(5000) + "1"));
        assertThrows(FormulaSyntaxException.class, () ->
                FormulaParser.parse("ABS(".repeat(limit + 1) + "1" + ")".repeat(limit + 1)));
    }

    @Test
    void testOperatorChainLimit() {
        int limit = FormulaParser.MAX_OPEN_OPERATORS;
        assertInstanceOf(BinaryExpression.class, FormulaParser.parse("1" + "+1".repeat(limit)));

        FormulaSyntaxException chain = assertThrows(FormulaSyntaxException.class, () ->
                FormulaParser.parse("1" + "+1".repeat(limit + 1)));
        assertEquals("Formula is nested too deeply", chain.getMessage());
    }
}
