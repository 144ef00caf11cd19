package com.sheetcalc.app.engine;

import com.sheetcalc.app.formula.BinaryExpression;
import com.sheetcalc.app.formula.BooleanLiteral;
import com.sheetcalc.app.formula.Expression;
import com.sheetcalc.app.formula.ExpressionVisitor;
import com.sheetcalc.app.formula.FunctionCall;
import com.sheetcalc.app.formula.NumberLiteral;
import com.sheetcalc.app.formula.ReferenceExpression;
import com.sheetcalc.app.formula.StringLiteral;
import com.sheetcalc.app.formula.UnaryExpression;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.CrossPageReference;
import com.sheetcalc.app.models.LocalCellReference;
import com.sheetcalc.app.models.LocalRangeReference;
import com.sheetcalc.app.models.Range;
import com.sheetcalc.app.models.ReferenceVisitor;
import com.sheetcalc.app.models.Sheet;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Walks one formula's expression and records what it reads:
 * local cells (ranges expanded to each cell) and unexpanded cross-page markers.
 * Every branch is walked, including IF branches that evaluation may skip.
 * Ranges wider than the configured limit only contribute the non-blank cells they cover.
 */
final class DependencyCollector implements ExpressionVisitor<Void>, ReferenceVisitor<Void> {

    private final Sheet sheet;
    private final long maxRangeCells;
    private final SortedSet<Address> local = new TreeSet<>();
    private final SortedSet<ExternalDependency> external = new TreeSet<>();

    private DependencyCollector(Sheet sheet, long maxRangeCells) {
        this.sheet = sheet;
        this.maxRangeCells = maxRangeCells;
    }

    static DependencyCollector collect(Expression expression, Sheet sheet, long maxRangeCells) {
        DependencyCollector collector = new DependencyCollector(sheet, maxRangeCells);
        expression.accept(collector);
        return collector;
    }

    Set<Address> getLocal() {
        return local;
    }

    Set<ExternalDependency> getExternal() {
        return external;
    }

    @Override
    public Void visitNumber(NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral node) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitReference(ReferenceExpression node) {
        return node.getReference().accept((ReferenceVisitor<Void>) this);
    }

    @Override
    public Void visitBinary(BinaryExpression node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression node) {
        return node.getOperand().accept(this);
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        for (Expression argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    @Override
    public Void visitLocal(LocalCellReference reference) {
        local.add(reference.getAddress());
        return null;
    }

    @Override
    public Void visitLocalRange(LocalRangeReference reference) {
        Range range = reference.getRange();
        if (range.size() <= maxRangeCells) {
            local.addAll(range.expand());
            return null;
        }
        // Too large to expand: blank cells have no edges, so the non-blank ones are enough
        for (Address address : sheet.getCells().keySet()) {
            if (range.contains(address)) {
                local.add(address);
            }
        }
        return null;
    }

    @Override
    public Void visitCrossPage(CrossPageReference reference) {
        external.add(new ExternalDependency(reference));
        return null;
    }
}
