package com.sheetcalc.app.engine;

import com.sheetcalc.app.exceptions.FormulaEvaluationException;
import com.sheetcalc.app.formula.BinaryExpression;
import com.sheetcalc.app.formula.BooleanLiteral;
import com.sheetcalc.app.formula.Expression;
import com.sheetcalc.app.formula.ExpressionVisitor;
import com.sheetcalc.app.formula.FunctionCall;
import com.sheetcalc.app.formula.NumberLiteral;
import com.sheetcalc.app.formula.ReferenceExpression;
import com.sheetcalc.app.formula.StringLiteral;
import com.sheetcalc.app.formula.UnaryExpression;
import com.sheetcalc.app.functions.Coercions;
import com.sheetcalc.app.functions.FunctionArguments;
import com.sheetcalc.app.functions.SheetFunction;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.CellReference;
import com.sheetcalc.app.models.CrossPageReference;
import com.sheetcalc.app.models.LocalCellReference;
import com.sheetcalc.app.models.LocalRangeReference;
import com.sheetcalc.app.models.Range;
import com.sheetcalc.app.models.ReferenceVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates the expression tree of one formula cell on one page.
 * Errors never escape as exceptions: every failure becomes an error value,
 * and the first error met (left to right) is the one returned.
 */
final class ExpressionEvaluator implements ExpressionVisitor<CellValue>, ReferenceVisitor<List<CellValue>> {

    private final EvaluationContext context;
    private final PageState page;

    ExpressionEvaluator(EvaluationContext context, PageState page) {
        this.context = context;
        this.page = page;
    }

    CellValue evaluate(Expression expression) {
        return finite(expression.accept(this));
    }

    @Override
    public CellValue visitNumber(NumberLiteral node) {
        return CellValue.number(node.getValue());
    }

    @Override
    public CellValue visitString(StringLiteral node) {
        return CellValue.text(node.getValue());
    }

    @Override
    public CellValue visitBoolean(BooleanLiteral node) {
        return CellValue.bool(node.getValue());
    }

    @Override
    public CellValue visitReference(ReferenceExpression node) {
        List<CellValue> values = referencedValues(node.getReference());
        return values.isEmpty() ? CellValue.blank() : values.get(0);
    }

    @Override
    public CellValue visitBinary(BinaryExpression node) {
        CellValue left = node.getLeft().accept(this);
        CellValue right = node.getRight().accept(this);
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        try {
            return finite(applyBinary(node, left, right));
        } catch (FormulaEvaluationException e) {
            return CellValue.error(e.getKind(), e.getMessage());
        }
    }

    private CellValue applyBinary(BinaryExpression node, CellValue left, CellValue right) {
        switch (node.getOperator()) {
            case ADD:
                return CellValue.number(Coercions.toNumber(left) + Coercions.toNumber(right));
            case SUBTRACT:
                return CellValue.number(Coercions.toNumber(left) - Coercions.toNumber(right));
            case MULTIPLY:
                return CellValue.number(Coercions.toNumber(left) * Coercions.toNumber(right));
            case DIVIDE:
                double divisor = Coercions.toNumber(right);
                double dividend = Coercions.toNumber(left);
                if (divisor == 0) {
                    throw new FormulaEvaluationException(ErrorKind.DIV0, "Division by zero");
                }
                return CellValue.number(dividend / divisor);
            case POWER:
                return CellValue.number(Math.pow(Coercions.toNumber(left), Coercions.toNumber(right)));
            case CONCAT:
                return CellValue.text(Coercions.toText(left) + Coercions.toText(right));
            case EQUAL:
                return CellValue.bool(areEqual(left, right));
            case NOT_EQUAL:
                return CellValue.bool(!areEqual(left, right));
            case LESS:
                return CellValue.bool(Coercions.toNumber(left) < Coercions.toNumber(right));
            case LESS_OR_EQUAL:
                return CellValue.bool(Coercions.toNumber(left) <= Coercions.toNumber(right));
            case GREATER:
                return CellValue.bool(Coercions.toNumber(left) > Coercions.toNumber(right));
            case GREATER_OR_EQUAL:
                return CellValue.bool(Coercions.toNumber(left) >= Coercions.toNumber(right));
            default:
                throw new FormulaEvaluationException(ErrorKind.VALUE,
                        "Unsupported operator " + node.getOperator().getSymbol());
        }
    }

    private static boolean areEqual(CellValue left, CellValue right) {
        if (Coercions.isCoercibleToNumber(left) && Coercions.isCoercibleToNumber(right)) {
            return Coercions.toNumber(left) == Coercions.toNumber(right);
        }
        return Coercions.toText(left).equals(Coercions.toText(right));
    }

    @Override
    public CellValue visitUnary(UnaryExpression node) {
        CellValue operand = node.getOperand().accept(this);
        if (operand.isError()) {
            return operand;
        }
        try {
            double number = Coercions.toNumber(operand);
            switch (node.getOperator()) {
                case NEGATE:
                    return CellValue.number(-number);
                case PLUS:
                default:
                    return CellValue.number(number);
            }
        } catch (FormulaEvaluationException e) {
            return CellValue.error(e.getKind(), e.getMessage());
        }
    }

    @Override
    public CellValue visitFunctionCall(FunctionCall node) {
        Optional<SheetFunction> lookup = context.getEngine().getFunctions().lookup(node.getName());
        if (lookup.isEmpty()) {
            return CellValue.error(ErrorKind.VALUE, "Unknown function " + node.getName());
        }
        SheetFunction function = lookup.get();
        Arguments arguments = new Arguments(node.getArguments());
        if (!function.isLazy()) {
            for (CellValue value : arguments.flattened()) {
                if (value.isError()) {
                    return value;
                }
            }
        }
        try {
            CellValue result = function.apply(arguments);
            return finite(result == null ? CellValue.blank() : result);
        } catch (FormulaEvaluationException e) {
            return CellValue.error(e.getKind(), e.getMessage());
        }
    }

    // References: every variant yields the referenced values in row-major order

    private List<CellValue> referencedValues(CellReference reference) {
        try {
            return reference.accept(this);
        } catch (FormulaEvaluationException e) {
            return List.of(CellValue.error(e.getKind(), e.getMessage()));
        }
    }

    @Override
    public List<CellValue> visitLocal(LocalCellReference reference) {
        return List.of(read(page, reference.getAddress()));
    }

    @Override
    public List<CellValue> visitLocalRange(LocalRangeReference reference) {
        return readRange(page, reference.getRange());
    }

    @Override
    public List<CellValue> visitCrossPage(CrossPageReference reference) {
        PageState target = context.resolvePage(reference.getPage());
        if (reference.isWholeSheet()) {
            String mention = reference.getPage().getRaw();
            throw new FormulaEvaluationException(ErrorKind.REF,
                    "Reference " + mention + " must name a cell or range, e.g. " + mention + ":A1");
        }
        if (reference.isRange()) {
            return readRange(target, reference.getRange());
        }
        return List.of(read(target, reference.getAddress()));
    }

    private List<CellValue> readRange(PageState source, Range range) {
        if (range.size() > context.getEngine().getMaxRangeCells()) {
            throw new FormulaEvaluationException(ErrorKind.VALUE, "Range is too large");
        }
        List<CellValue> values = new ArrayList<>();
        for (Address address : range.expand()) {
            values.add(read(source, address));
        }
        return values;
    }

    /**
     * The value another cell contributes to this formula. A failed cell passes on a propagated error.
     */
    private CellValue read(PageState source, Address address) {
        CellValue value = context.evaluateCell(source, address).getValue();
        if (value.isError()) {
            return CellValue.error(CellError.propagatedFrom(value.getError()));
        }
        return value;
    }

    private static CellValue finite(CellValue value) {
        if (value.isNumber() && !Double.isFinite(value.getNumber())) {
            return CellValue.error(ErrorKind.VALUE, "Result is not a finite number");
        }
        return value;
    }

    /**
     * Function arguments evaluated on first access and kept for the rest of the call.
     */
    private final class Arguments implements FunctionArguments {
        private final List<Expression> expressions;
        private final List<List<CellValue>> values;

        Arguments(List<Expression> expressions) {
            this.expressions = expressions;
            this.values = new ArrayList<>(expressions.size());
            for (int i = 0; i < expressions.size(); i++) {
                values.add(null);
            }
        }

        @Override
        public int count() {
            return expressions.size();
        }

        @Override
        public CellValue get(int index) {
            List<CellValue> all = getAll(index);
            return all.isEmpty() ? CellValue.blank() : all.get(0);
        }

        @Override
        public List<CellValue> getAll(int index) {
            if (index < 0 || index >= expressions.size()) {
                throw new FormulaEvaluationException(ErrorKind.VALUE, "Missing argument " + (index + 1));
            }
            List<CellValue> known = values.get(index);
            if (known == null) {
                known = evaluateArgument(expressions.get(index));
                values.set(index, known);
            }
            return known;
        }

        @Override
        public List<CellValue> flattened() {
            List<CellValue> all = new ArrayList<>();
            for (int i = 0; i < expressions.size(); i++) {
                all.addAll(getAll(i));
            }
            return all;
        }

        private List<CellValue> evaluateArgument(Expression expression) {
            if (expression instanceof ReferenceExpression) {
                return referencedValues(((ReferenceExpression) expression).getReference());
            }
            return List.of(finite(expression.accept(ExpressionEvaluator.this)));
        }
    }
}
