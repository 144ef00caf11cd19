package com.sheetcalc.app.formula;

import java.util.Objects;

public final class UnaryExpression implements Expression {
    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryExpression(UnaryOperator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnaryExpression)) {
            return false;
        }
        UnaryExpression that = (UnaryExpression) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator.getSymbol() + operand;
    }
}
