package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Span;

/**
 * Base class of every compilation failure. Carries the 1-based source
 * position the error is reported at.
 */
public abstract class H2Exception extends Exception {

    private final int line;
    private final int column;

    protected H2Exception(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    protected H2Exception(String message, Span span) {
        this(message, span.line(), span.column());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Message without the position prefix added by {@link #toString()}.
     */
    public String getDetail() {
        return getMessage();
    }

    @Override
    public String toString() {
        return stage() + " error at line " + line + ", column " + column + ": " + getDetail();
    }

    /** Pipeline stage name used in {@link #toString()}. */
    protected abstract String stage();
}
