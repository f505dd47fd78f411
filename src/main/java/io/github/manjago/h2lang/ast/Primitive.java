package io.github.manjago.h2lang.ast;

/**
 * The three atomic robot commands as written in source.
 */
public enum Primitive {

    /** Move one cell forward. */
    STRAIGHT('s'),

    /** Turn 90 degrees clockwise. */
    RIGHT('r'),

    /** Turn 90 degrees counter-clockwise. */
    LEFT('l');

    private final char letter;

    Primitive(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }
}
