package io.github.manjago.h2lang.core;

/**
 * Counts "golf bytes", the score of a program's length.
 * <p>
 * Every letter (command, identifier, parameter) and every number counts 1,
 * however many digits it has. Punctuation, blanks, agent IDs and directive
 * lines are free.
 */
public final class GolfByteCounter {

    private GolfByteCounter() {
    }

    /**
     * Count golf bytes of a program that must parse.
     *
     * @throws Lexer.LexerException  if the source does not tokenize
     * @throws Parser.ParseException if the source does not parse
     */
    public static int count(String source) throws Lexer.LexerException, Parser.ParseException {
        new Parser(source).parseProgram();

        int bytes = 0;
        boolean directiveLine = false;
        for (Token token : new Lexer(source).tokenize()) {
            switch (token.kind()) {
                case DIRECTIVE -> directiveLine = true;
                case NEWLINE -> directiveLine = false;
                case STRAIGHT, RIGHT, LEFT, IDENT, PARAM, NUMBER -> {
                    if (!directiveLine) {
                        bytes++;
                    }
                }
                default -> {
                    // free
                }
            }
        }
        return bytes;
    }
}
