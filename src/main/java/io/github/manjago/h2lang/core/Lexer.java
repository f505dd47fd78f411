package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the H2 language.
 * <p>
 * Converts source text into a flat token stream. Blanks are not skipped: a run
 * of spaces and tabs becomes one {@link TokenKind#SPACE} token because a space
 * terminates a definition body.
 *
 * <h2>Lexical rules:</h2>
 * <pre>
 * # comment, // comment   stripped up to (not including) the line break
 * s r l                   commands
 * a-z (other letters)     identifiers
 * A-Z                     parameters
 * 123                     agent ID at line start, number elsewhere
 * : ( ) , + -             punctuation
 * MAX_STEP=100            directive line (name, '=', number or word)
 * </pre>
 * <p>
 * Positions are tracked against the original string by absolute index, so
 * looking ahead (for {@code //} or a directive name) never has to undo
 * consumed characters.
 */
public class Lexer {

    private final String source;

    // Absolute char index into source and matching UTF-8 byte offset
    private int index = 0;
    private int bytePos = 0;

    private int line = 1;
    private int column = 1;
    private boolean atLineStart = true;
    private boolean inDirectiveLine = false;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the whole input. The last token is always {@link TokenKind#EOF}.
     *
     * @return tokens in source order
     * @throws LexerException at the first unexpected character
     */
    public List<Token> tokenize() throws LexerException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = nextToken();
            tokens.add(token);
            if (token.is(TokenKind.EOF)) {
                return tokens;
            }
        }
    }

    /**
     * Read the next token. Returns EOF forever once the input is exhausted.
     */
    public Token nextToken() throws LexerException {
        skipComment();

        int startByte = bytePos;
        int startLine = line;
        int startColumn = column;

        if (index >= source.length()) {
            return Token.of(TokenKind.EOF, new Span(startByte, startByte, startLine, startColumn));
        }

        int ch = advance();

        if (ch == '\n' || ch == '\r') {
            if (ch == '\r' && peek(0) == '\n') {
                advance();
            }
            line++;
            column = 1;
            atLineStart = true;
            inDirectiveLine = false;
            return Token.of(TokenKind.NEWLINE, span(startByte, startLine, startColumn));
        }

        if (ch == ' ' || ch == '\t') {
            while (peek(0) == ' ' || peek(0) == '\t') {
                advance();
            }
            return Token.of(TokenKind.SPACE, span(startByte, startLine, startColumn));
        }

        if (inDirectiveLine) {
            return directiveLineToken(ch, startByte, startLine, startColumn);
        }

        if (atLineStart && isUpper(ch) && startsDirective()) {
            atLineStart = false;
            inDirectiveLine = true;
            String name = readWord(ch);
            return Token.text(TokenKind.DIRECTIVE, name, span(startByte, startLine, startColumn));
        }

        boolean wasAtLineStart = atLineStart;
        atLineStart = false;

        TokenKind kind = switch (ch) {
            case 's' -> TokenKind.STRAIGHT;
            case 'r' -> TokenKind.RIGHT;
            case 'l' -> TokenKind.LEFT;
            case ':' -> TokenKind.COLON;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ',' -> TokenKind.COMMA;
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            default -> null;
        };
        if (kind != null) {
            return Token.of(kind, span(startByte, startLine, startColumn));
        }

        if (ch >= 'a' && ch <= 'z') {
            return Token.letter(TokenKind.IDENT, (char) ch, span(startByte, startLine, startColumn));
        }
        if (isUpper(ch)) {
            return Token.letter(TokenKind.PARAM, (char) ch, span(startByte, startLine, startColumn));
        }
        if (isDigit(ch)) {
            long value = readNumber(ch);
            TokenKind numberKind = wasAtLineStart ? TokenKind.AGENT_ID : TokenKind.NUMBER;
            return Token.number(numberKind, value, span(startByte, startLine, startColumn));
        }

        throw unexpected(ch, startLine, startColumn);
    }

    /**
     * Token on the right-hand side of a directive line.
     */
    private Token directiveLineToken(int ch, int startByte, int startLine, int startColumn)
            throws LexerException {
        if (ch == '=') {
            return Token.of(TokenKind.EQUALS, span(startByte, startLine, startColumn));
        }
        if (ch == '-' && isDigit(peek(0))) {
            long value = -readNumber(advance());
            return Token.number(TokenKind.NUMBER, value, span(startByte, startLine, startColumn));
        }
        if (isDigit(ch)) {
            long value = readNumber(ch);
            return Token.number(TokenKind.NUMBER, value, span(startByte, startLine, startColumn));
        }
        if (isWordChar(ch)) {
            String word = readWord(ch);
            return Token.text(TokenKind.DIRECTIVE_VALUE, word, span(startByte, startLine, startColumn));
        }
        throw unexpected(ch, startLine, startColumn);
    }

    /**
     * Skip {@code #...} and {@code //...} up to the line break.
     * A single {@code /} is left in place and reported by {@link #nextToken()}.
     */
    private void skipComment() {
        int ch = peek(0);
        boolean comment = ch == '#' || (ch == '/' && peek(1) == '/');
        if (!comment) {
            return;
        }
        while (index < source.length() && peek(0) != '\n' && peek(0) != '\r') {
            advance();
        }
    }

    /**
     * At an uppercase letter already consumed: does {@code [A-Z_]* blank* '='} follow?
     */
    private boolean startsDirective() {
        int i = 0;
        while (isUpper(peek(i)) || peek(i) == '_') {
            i++;
        }
        while (peek(i) == ' ' || peek(i) == '\t') {
            i++;
        }
        return peek(i) == '=';
    }

    private String readWord(int first) {
        StringBuilder sb = new StringBuilder();
        sb.appendCodePoint(first);
        while (isWordChar(peek(0))) {
            sb.appendCodePoint(advance());
        }
        return sb.toString();
    }

    /**
     * Read a digit run; the value saturates instead of overflowing.
     */
    private long readNumber(int firstDigit) {
        long value = firstDigit - '0';
        while (isDigit(peek(0))) {
            int digit = advance() - '0';
            value = value > (Long.MAX_VALUE - digit) / 10 ? Long.MAX_VALUE : value * 10 + digit;
        }
        return value;
    }

    /**
     * Code point {@code offset} code points ahead of the current position, or -1 past the end.
     */
    private int peek(int offset) {
        int i = index;
        for (int n = 0; n < offset; n++) {
            if (i >= source.length()) {
                return -1;
            }
            i += Character.charCount(source.codePointAt(i));
        }
        return i < source.length() ? source.codePointAt(i) : -1;
    }

    private int advance() {
        int cp = source.codePointAt(index);
        index += Character.charCount(cp);
        bytePos += utf8Length(cp);
        if (cp != '\n' && cp != '\r') {
            column++;
        }
        return cp;
    }

    private Span span(int startByte, int startLine, int startColumn) {
        return new Span(startByte, bytePos, startLine, startColumn);
    }

    private static LexerException unexpected(int ch, int line, int column) {
        return new LexerException("Unexpected character '" + new String(Character.toChars(ch)) + "'",
                line, column);
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) {
            return 1;
        } else if (cp < 0x800) {
            return 2;
        } else if (cp < 0x10000) {
            return 3;
        }
        return 4;
    }

    private static boolean isUpper(int ch) {
        return ch >= 'A' && ch <= 'Z';
    }

    private static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isWordChar(int ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || ch == '_';
    }

    // ========== Helper classes ==========

    /**
     * Unexpected character in the source.
     */
    public static class LexerException extends H2Exception {

        public LexerException(String message, int line, int column) {
            super(message, line, column);
        }

        @Override
        protected String stage() {
            return "Lexer";
        }
    }
}
