package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recursive-descent parser for the H2 language.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * MAX_STEP=1000            ; optional directives, before any code
 * ON_LIMIT=TRUNCATE
 * 0: x:ss f(X):sXr xf(l)   ; agent block: definitions and root terms
 * 1: a(X):sa(X-1) a(4)
 * </pre>
 * Without a leading agent ID the whole input is agent 0. A definition body
 * ends at a space, a line break or the start of the next definition, so
 * several definitions can share one line.
 * <p>
 * The whole token stream is produced up front; lookahead is an index into it.
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final LimitConfig defaults;
    private int pos = 0;

    /**
     * Create parser with built-in limit defaults.
     *
     * @throws Lexer.LexerException if the source cannot be tokenized
     */
    public Parser(String source) throws Lexer.LexerException {
        this(source, LimitConfig.defaults());
    }

    /**
     * Create parser whose directives override the given defaults.
     *
     * @throws Lexer.LexerException if the source cannot be tokenized
     */
    public Parser(String source, LimitConfig defaults) throws Lexer.LexerException {
        this.tokens = new Lexer(source).tokenize();
        this.defaults = defaults;
    }

    /**
     * Parse the whole program.
     *
     * @return immutable program
     * @throws ParseException on the first syntax, directive or type-conflict error
     */
    public Program parseProgram() throws ParseException {
        skipBlank();

        List<Directive> directives = parseDirectives();
        LimitConfig limits = buildLimitConfig(directives, defaults);

        skipBlank();

        List<Agent> agents = new ArrayList<>();
        if (check(TokenKind.AGENT_ID)) {
            while (!check(TokenKind.EOF)) {
                agents.add(parseAgentBlock());
                skipBlank();
            }
        } else if (!check(TokenKind.EOF)) {
            agents.add(parseImplicitAgent());
            if (!check(TokenKind.EOF)) {
                // Agent blocks cannot follow code that has no agent ID
                throw ParseException.unexpectedToken(TokenKind.EOF.description(), current());
            }
        }

        log.debug("Parsed {} directive(s), {} agent(s), limits: {}", directives.size(), agents.size(), limits);
        return new Program(directives, limits, agents);
    }

    // ========== Directives ==========

    private List<Directive> parseDirectives() throws ParseException {
        List<Directive> directives = new ArrayList<>();

        while (true) {
            skipBlank();
            if (!check(TokenKind.DIRECTIVE)) {
                return directives;
            }

            Token name = advance();
            skipSpace();
            expect(TokenKind.EQUALS);
            skipSpace();

            Directive.Value value;
            Token current = current();
            if (current.is(TokenKind.NUMBER)) {
                value = new Directive.Value.Number(current.number());
            } else if (current.is(TokenKind.DIRECTIVE_VALUE)) {
                value = new Directive.Value.Text(current.text());
            } else {
                throw ParseException.unexpectedToken("number or ERROR/TRUNCATE", current);
            }
            advance();

            directives.add(new Directive(name.text(), value, Span.cover(name.span(), previousSpan())));

            skipSpace();
            if (!check(TokenKind.NEWLINE) && !check(TokenKind.EOF)) {
                throw ParseException.unexpectedToken("newline or end of input", current());
            }
        }
    }

    /**
     * Fold directives over the defaults, validating every value.
     */
    static LimitConfig buildLimitConfig(List<Directive> directives, LimitConfig defaults)
            throws ParseException {
        LimitConfig config = defaults;

        for (Directive directive : directives) {
            config = switch (directive.name()) {
                case "MAX_STEP" -> config.withMaxStep(
                        numericDirective(directive, LimitConfig.MAX_STEP_CEILING));
                case "MAX_DEPTH" -> config.withMaxDepth(
                        numericDirective(directive, LimitConfig.MAX_DEPTH_CEILING));
                case "MAX_MEMORY" -> config.withMaxMemory(
                        numericDirective(directive, LimitConfig.MAX_MEMORY_CEILING));
                case "ON_LIMIT" -> config.withOnLimit(onLimitDirective(directive));
                default -> throw new ParseException(
                        "Unknown directive '" + directive.name() + "' (E009)", directive.span());
            };
        }
        return config;
    }

    private static int numericDirective(Directive directive, int ceiling) throws ParseException {
        if (!(directive.value() instanceof Directive.Value.Number number)) {
            throw new ParseException(directive.name() + " requires a numeric value (E009)", directive.span());
        }
        long n = number.value();
        if (n < 1 || n > ceiling) {
            throw new ParseException(String.format("%s value %d out of range (1..%d) (E009)",
                    directive.name(), n, ceiling), directive.span());
        }
        return (int) n;
    }

    private static OnLimit onLimitDirective(Directive directive) throws ParseException {
        if (!(directive.value() instanceof Directive.Value.Text text)) {
            throw new ParseException("ON_LIMIT requires ERROR or TRUNCATE (E009)", directive.span());
        }
        // Directive words are case-sensitive, unlike the HOCON setting
        return switch (text.value()) {
            case "ERROR" -> OnLimit.ERROR;
            case "TRUNCATE" -> OnLimit.TRUNCATE;
            default -> throw new ParseException("ON_LIMIT value '" + text.value()
                    + "' invalid, expected ERROR or TRUNCATE (E009)", directive.span());
        };
    }

    // ========== Agents ==========

    private Agent parseAgentBlock() throws ParseException {
        Token idToken = expect(TokenKind.AGENT_ID);
        expect(TokenKind.COLON);

        List<FuncDef> definitions = new ArrayList<>();
        Expr expression = parseStatementList(definitions);

        return new Agent(idToken.intValue(), definitions, expression,
                Span.cover(idToken.span(), previousSpan()));
    }

    private Agent parseImplicitAgent() throws ParseException {
        Span start = current().span();

        List<FuncDef> definitions = new ArrayList<>();
        Expr expression = parseStatementList(definitions);

        return new Agent(0, definitions, expression, Span.cover(start, previousSpan()));
    }

    /**
     * Definitions and root terms, across lines, until the next agent ID or EOF.
     *
     * @param definitions receives the definitions found
     * @return root expression
     */
    private Expr parseStatementList(List<FuncDef> definitions) throws ParseException {
        List<Expr> terms = new ArrayList<>();

        while (true) {
            skipBlank();
            if (check(TokenKind.EOF) || check(TokenKind.AGENT_ID)) {
                break;
            }
            if (startsDefinition()) {
                definitions.add(parseDefinition());
            } else {
                terms.add(parseTerm());
            }
        }
        return Expr.of(terms);
    }

    // ========== Definitions ==========

    /**
     * {@code IDENT ':'} or {@code IDENT '(' PARAM,... ')' ':'} at the current position.
     */
    private boolean startsDefinition() {
        if (!check(TokenKind.IDENT)) {
            return false;
        }
        TokenKind next = peek(1).kind();
        if (next == TokenKind.COLON) {
            return true;
        }
        return next == TokenKind.LPAREN && isFunctionDefinition();
    }

    /**
     * Scan past {@code IDENT '('} over parameters and commas: a definition has
     * {@code ')' ':'} right after them, a call has anything else.
     */
    private boolean isFunctionDefinition() {
        int i = 2;
        while (true) {
            TokenKind kind = peek(i).kind();
            if (kind == TokenKind.PARAM || kind == TokenKind.COMMA) {
                i++;
            } else if (kind == TokenKind.RPAREN) {
                return peek(i + 1).is(TokenKind.COLON);
            } else {
                return false;
            }
        }
    }

    private FuncDef parseDefinition() throws ParseException {
        Token nameToken = expect(TokenKind.IDENT);
        char name = nameToken.letter();

        List<Character> params = new ArrayList<>();
        if (check(TokenKind.LPAREN)) {
            advance();
            if (!check(TokenKind.RPAREN)) {
                while (true) {
                    Token param = current();
                    if (!param.is(TokenKind.PARAM)) {
                        throw ParseException.unexpectedToken("parameter (uppercase letter)", param);
                    }
                    if (params.contains(param.letter())) {
                        throw new ParseException("Duplicate parameter '" + param.letter()
                                + "' in definition of '" + name + "'", param.span());
                    }
                    params.add(param.letter());
                    advance();
                    if (!check(TokenKind.COMMA)) {
                        break;
                    }
                    advance();
                }
            }
            expect(TokenKind.RPAREN);
        }
        expect(TokenKind.COLON);

        // No skipSpace here: a space ends the body
        Expr body = parseDefinitionBody();

        Map<Character, ParamType> types = ParamTypeInference.infer(name, params, body);
        return new FuncDef(name, params, types, body, Span.cover(nameToken.span(), previousSpan()));
    }

    private Expr parseDefinitionBody() throws ParseException {
        List<Expr> terms = new ArrayList<>();
        while (!check(TokenKind.SPACE) && !check(TokenKind.NEWLINE) && !check(TokenKind.EOF)
                && !startsDefinition()) {
            terms.add(parseTerm());
        }
        return Expr.of(terms);
    }

    // ========== Terms ==========

    private Expr parseTerm() throws ParseException {
        Token token = current();

        switch (token.kind()) {
            case STRAIGHT, RIGHT, LEFT -> {
                advance();
                return new Expr.PrimitiveExpr(token.primitive(), token.span());
            }
            case IDENT -> {
                if (peek(1).is(TokenKind.LPAREN)) {
                    return parseCall();
                }
                advance();
                return new Expr.Identifier(token.letter(), token.span());
            }
            case PARAM -> {
                advance();
                return new Expr.ParamRef(token.letter(), token.span());
            }
            case LPAREN -> {
                return parseGroup();
            }
            default -> throw ParseException.unexpectedToken(
                    "'s', 'r', 'l', identifier, parameter or '('", token);
        }
    }

    /**
     * {@code '(' term* ')'}; blanks inside the group are ignored.
     */
    private Expr parseGroup() throws ParseException {
        expect(TokenKind.LPAREN);
        List<Expr> terms = new ArrayList<>();
        while (true) {
            skipSpace();
            if (check(TokenKind.RPAREN) || check(TokenKind.NEWLINE) || check(TokenKind.EOF)) {
                break;
            }
            terms.add(parseTerm());
        }
        expect(TokenKind.RPAREN);
        return Expr.of(terms);
    }

    private Expr parseCall() throws ParseException {
        Token nameToken = expect(TokenKind.IDENT);
        expect(TokenKind.LPAREN);

        List<Arg> args = new ArrayList<>();
        skipSpace();
        if (!check(TokenKind.RPAREN)) {
            while (true) {
                args.add(parseArg());
                skipSpace();
                if (!check(TokenKind.COMMA)) {
                    break;
                }
                advance();
            }
        }
        Token close = expect(TokenKind.RPAREN);

        return new Expr.FunctionCall(nameToken.letter(), args, Span.cover(nameToken.span(), close.span()));
    }

    // ========== Arguments ==========

    private Arg parseArg() throws ParseException {
        skipSpace();
        Token token = current();

        switch (token.kind()) {
            case COMMA, RPAREN -> {
                // f(s,) and f(,s): omitted argument is an empty command sequence
                return new Arg.CommandArg(Expr.empty());
            }
            case MINUS -> {
                advance();
                Token number = current();
                if (!number.is(TokenKind.NUMBER)) {
                    throw ParseException.unexpectedToken("number after '-'", number);
                }
                advance();
                NumAtom first = new NumAtom.Literal(negate(number.intValue()));
                if (isNumOp(current())) {
                    return parseNumExpr(first, token.span());
                }
                return new Arg.NumberArg(negate(number.intValue()), Span.cover(token.span(), number.span()));
            }
            case NUMBER -> {
                advance();
                if (isNumOp(current())) {
                    return parseNumExpr(new NumAtom.Literal(token.intValue()), token.span());
                }
                return new Arg.NumberArg(token.intValue(), token.span());
            }
            case PARAM -> {
                if (isNumOp(peek(1))) {
                    advance();
                    return parseNumExpr(new NumAtom.ParamAtom(token.letter()), token.span());
                }
                return new Arg.CommandArg(parseArgExpression());
            }
            default -> {
                return new Arg.CommandArg(parseArgExpression());
            }
        }
    }

    /**
     * Remaining {@code (op atom)+} after the first atom has been consumed.
     */
    private Arg parseNumExpr(NumAtom first, Span start) throws ParseException {
        List<Arg.NumTerm> rest = new ArrayList<>();

        while (isNumOp(current())) {
            NumOp op = advance().is(TokenKind.PLUS) ? NumOp.ADD : NumOp.SUBTRACT;
            Token atom = current();
            if (atom.is(TokenKind.NUMBER)) {
                rest.add(new Arg.NumTerm(op, new NumAtom.Literal(atom.intValue())));
            } else if (atom.is(TokenKind.PARAM)) {
                rest.add(new Arg.NumTerm(op, new NumAtom.ParamAtom(atom.letter())));
            } else {
                throw ParseException.unexpectedToken("number or parameter", atom);
            }
            advance();
        }
        return new Arg.NumExprArg(first, rest, Span.cover(start, previousSpan()));
    }

    private Expr parseArgExpression() throws ParseException {
        List<Expr> terms = new ArrayList<>();
        while (true) {
            skipSpace();
            if (check(TokenKind.RPAREN) || check(TokenKind.COMMA)
                    || check(TokenKind.NEWLINE) || check(TokenKind.EOF)) {
                break;
            }
            terms.add(parseTerm());
        }
        return Expr.of(terms);
    }

    private static boolean isNumOp(Token token) {
        return token.is(TokenKind.PLUS) || token.is(TokenKind.MINUS);
    }

    private static int negate(int value) {
        return value == Integer.MIN_VALUE ? Integer.MAX_VALUE : -value;
    }

    // ========== Token helpers ==========

    private Token current() {
        return peek(0);
    }

    /**
     * Token {@code n} positions ahead; the trailing EOF repeats past the end.
     */
    private Token peek(int n) {
        int i = Math.min(pos + n, tokens.size() - 1);
        return tokens.get(i);
    }

    private boolean check(TokenKind kind) {
        return current().is(kind);
    }

    private Token advance() {
        Token token = current();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private Span previousSpan() {
        return pos > 0 ? tokens.get(pos - 1).span() : current().span();
    }

    private Token expect(TokenKind kind) throws ParseException {
        if (!check(kind)) {
            throw ParseException.unexpectedToken(kind.description(), current());
        }
        return advance();
    }

    private void skipSpace() {
        while (check(TokenKind.SPACE)) {
            advance();
        }
    }

    private void skipBlank() {
        while (current().kind().isWhitespace()) {
            advance();
        }
    }

    // ========== Helper classes ==========

    /**
     * Syntax, directive or definition-time type error.
     */
    public static class ParseException extends H2Exception {

        private final String expected;
        private final String found;

        public ParseException(String message, Span span) {
            this(message, span, null, null);
        }

        public ParseException(String message, Span span, @Nullable String expected, @Nullable String found) {
            super(message, span);
            this.expected = expected;
            this.found = found;
        }

        static ParseException unexpectedToken(String expected, Token found) {
            if (found.is(TokenKind.EOF)) {
                return new ParseException("Unexpected end of input", found.span(), expected,
                        TokenKind.EOF.description());
            }
            return new ParseException("Unexpected token", found.span(), expected, found.kind().description());
        }

        public Optional<String> getExpected() {
            return Optional.ofNullable(expected);
        }

        public Optional<String> getFound() {
            return Optional.ofNullable(found);
        }

        /**
         * Message with expected/found folded in, as reported to the host.
         */
        @Override
        public String getDetail() {
            StringBuilder sb = new StringBuilder(getMessage());
            if (expected != null) {
                sb.append(" (expected: ").append(expected).append(')');
            }
            if (found != null) {
                sb.append(" (found: ").append(found).append(')');
            }
            return sb.toString();
        }

        @Override
        protected String stage() {
            return "Parse";
        }
    }
}
