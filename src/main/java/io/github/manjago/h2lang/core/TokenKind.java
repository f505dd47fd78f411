package io.github.manjago.h2lang.core;

/**
 * Token categories produced by {@link Lexer}.
 */
public enum TokenKind {

    // ========== Literals ==========

    /** Digit run at the start of a line, e.g. {@code 0} in {@code 0: srl}. */
    AGENT_ID("agent ID"),

    /** Lowercase letter other than s/r/l: macro or function name. */
    IDENT("identifier"),

    /** Uppercase letter: function parameter. */
    PARAM("parameter"),

    NUMBER("number"),

    // ========== Commands ==========

    STRAIGHT("'s'"),
    RIGHT("'r'"),
    LEFT("'l'"),

    // ========== Punctuation ==========

    COLON("':'"),
    LPAREN("'('"),
    RPAREN("')'"),
    COMMA("','"),
    PLUS("'+'"),
    MINUS("'-'"),

    // ========== Directives ==========

    /** Directive name such as {@code MAX_STEP}. */
    DIRECTIVE("directive"),

    EQUALS("'='"),

    /** Word on the right of a directive, e.g. {@code TRUNCATE}. */
    DIRECTIVE_VALUE("directive value"),

    // ========== Control ==========

    SPACE("space"),
    NEWLINE("newline"),
    EOF("end of input");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /**
     * Human-readable description used in "expected X, found Y" messages.
     */
    public String description() {
        return description;
    }

    public boolean isWhitespace() {
        return this == SPACE || this == NEWLINE;
    }
}
