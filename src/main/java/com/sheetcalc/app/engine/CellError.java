package com.sheetcalc.app.engine;

import java.util.Objects;

/**
 * An error carried by a cell value.
 * For PROPAGATED errors, rootKind remembers what actually went wrong upstream
 * and the message is the upstream message, unchanged.
 */
public final class CellError {

    public static final String CIRCULAR_MESSAGE = "Circular reference detected";

    private final ErrorKind kind;
    private final ErrorKind rootKind;
    private final String message;

    private CellError(ErrorKind kind, ErrorKind rootKind, String message) {
        this.kind = kind;
        this.rootKind = rootKind;
        this.message = message;
    }

    public static CellError of(ErrorKind kind, String message) {
        if (kind == ErrorKind.PROPAGATED) {
            throw new IllegalArgumentException("Propagated errors are derived from another error");
        }
        return new CellError(kind, kind, Objects.requireNonNull(message, "message"));
    }

    public static CellError circular() {
        return of(ErrorKind.CIRCULAR, CIRCULAR_MESSAGE);
    }

    /**
     * The error a cell gets when something it reads failed with {@code source}.
     */
    public static CellError propagatedFrom(CellError source) {
        if (source.kind == ErrorKind.PROPAGATED) {
            return source;
        }
        return new CellError(ErrorKind.PROPAGATED, source.kind, source.message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorKind getRootKind() {
        return rootKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Kind-specific marker, e.g. "#DIV/0!". Propagated errors use their root kind's marker.
     */
    public String getToken() {
        return rootKind.getToken();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellError)) {
            return false;
        }
        CellError that = (CellError) o;
        return kind == that.kind && rootKind == that.rootKind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rootKind, message);
    }

    @Override
    public String toString() {
        return kind == rootKind ? kind + ": " + message : kind + "(" + rootKind + "): " + message;
    }
}
