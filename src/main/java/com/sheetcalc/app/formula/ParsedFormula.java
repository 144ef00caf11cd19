package com.sheetcalc.app.formula;

/**
 * Result of parsing one formula: either an expression or a syntax error message, never both.
 */
public final class ParsedFormula {
    private final Expression expression;
    private final String error;

    private ParsedFormula(Expression expression, String error) {
        this.expression = expression;
        this.error = error;
    }

    public static ParsedFormula of(Expression expression) {
        return new ParsedFormula(expression, null);
    }

    public static ParsedFormula failed(String error) {
        return new ParsedFormula(null, error);
    }

    public boolean isValid() {
        return expression != null;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getError() {
        return error;
    }
}
