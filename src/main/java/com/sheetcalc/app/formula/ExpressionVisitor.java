package com.sheetcalc.app.formula;

public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitString(StringLiteral node);

    R visitBoolean(BooleanLiteral node);

    R visitReference(ReferenceExpression node);

    R visitBinary(BinaryExpression node);

    R visitUnary(UnaryExpression node);

    R visitFunctionCall(FunctionCall node);
}
