package com.sheetcalc.app.engine;

/**
 * Every way a cell can fail to produce a value, each with its short display marker.
 */
public enum ErrorKind {
    /** Malformed formula syntax. */
    PARSE("#PARSE!"),
    /** The cell is a member of a reference cycle, local or across sheets. */
    CIRCULAR("#CYCLE!"),
    /** A cross-page reference could not be resolved. */
    REF("#REF!"),
    /** Division by zero, including AVERAGE over no numbers. */
    DIV0("#DIV/0!"),
    /** An operand or argument had the wrong type or shape. */
    VALUE("#VALUE!"),
    /** The formula is fine but a cell it reads is an error; renders with the root kind's marker. */
    PROPAGATED("#ERROR");

    private final String token;

    ErrorKind(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
