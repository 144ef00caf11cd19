package com.sheetcalc.app.formula;

/**
 * A node of a parsed formula. The node kinds are fixed:
 * NumberLiteral, StringLiteral, BooleanLiteral, ReferenceExpression,
 * BinaryExpression, UnaryExpression and FunctionCall.
 * Adding a kind means adding a method to {@link ExpressionVisitor}, which every walker must then implement.
 * Nodes are immutable and may be shared between evaluations.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
