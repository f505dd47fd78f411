package io.github.manjago.h2lang.ast;

/**
 * Operators allowed in numeric arguments.
 */
public enum NumOp {
    ADD('+'),
    SUBTRACT('-');

    private final char symbol;

    NumOp(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public int apply(int left, int right) {
        return this == ADD ? left + right : left - right;
    }
}
