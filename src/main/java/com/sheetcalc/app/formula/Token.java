package com.sheetcalc.app.formula;

import com.sheetcalc.app.models.PageRef;

/**
 * One lexical unit of a formula. PAGE tokens also carry the parsed page mention.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final PageRef page;

    Token(TokenType type, String text) {
        this(type, text, null);
    }

    Token(TokenType type, String text, PageRef page) {
        this.type = type;
        this.text = text;
        this.page = page;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public PageRef getPage() {
        return page;
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
