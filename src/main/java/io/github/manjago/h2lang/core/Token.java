package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Primitive;
import io.github.manjago.h2lang.ast.Span;

/**
 * Lexical token.
 *
 * @param kind   category
 * @param letter name letter for IDENT and PARAM, otherwise {@code '\0'}
 * @param number value for AGENT_ID and NUMBER, otherwise 0
 * @param text   name for DIRECTIVE and DIRECTIVE_VALUE, otherwise null
 */
public record Token(TokenKind kind, char letter, long number, String text, Span span) {

    public static Token of(TokenKind kind, Span span) {
        return new Token(kind, '\0', 0, null, span);
    }

    public static Token letter(TokenKind kind, char letter, Span span) {
        return new Token(kind, letter, 0, null, span);
    }

    public static Token number(TokenKind kind, long value, Span span) {
        return new Token(kind, '\0', value, null, span);
    }

    public static Token text(TokenKind kind, String text, Span span) {
        return new Token(kind, '\0', 0, text, span);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    /**
     * Numeric payload narrowed to int, saturating at the int range.
     */
    public int intValue() {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, number));
    }

    public Primitive primitive() {
        return switch (kind) {
            case STRAIGHT -> Primitive.STRAIGHT;
            case RIGHT -> Primitive.RIGHT;
            case LEFT -> Primitive.LEFT;
            default -> throw new IllegalStateException("Not a command token: " + kind);
        };
    }

    /**
     * Source-like rendering of the token.
     */
    public String lexeme() {
        return switch (kind) {
            case AGENT_ID, NUMBER -> Long.toString(number);
            case IDENT, PARAM -> String.valueOf(letter);
            case DIRECTIVE, DIRECTIVE_VALUE -> text;
            case STRAIGHT -> "s";
            case RIGHT -> "r";
            case LEFT -> "l";
            case COLON -> ":";
            case LPAREN -> "(";
            case RPAREN -> ")";
            case COMMA -> ",";
            case PLUS -> "+";
            case MINUS -> "-";
            case EQUALS -> "=";
            case SPACE -> " ";
            case NEWLINE -> "\\n";
            case EOF -> "EOF";
        };
    }

    @Override
    public String toString() {
        return lexeme() + " at " + span;
    }
}
