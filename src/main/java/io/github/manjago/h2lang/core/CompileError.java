package io.github.manjago.h2lang.core;

/**
 * Error as reported to callers of {@link H2Compiler}.
 *
 * @param line    1-based line
 * @param column  1-based column
 * @param message message, with expected/found folded in for parse errors
 */
public record CompileError(int line, int column, String message) {

    public static CompileError from(H2Exception e) {
        return new CompileError(e.getLine(), e.getColumn(), e.getDetail());
    }

    @Override
    public String toString() {
        return line + ":" + column + ": " + message;
    }
}
