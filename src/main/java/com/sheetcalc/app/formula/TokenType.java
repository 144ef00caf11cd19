package com.sheetcalc.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    CELL,
    PAGE,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON
}
