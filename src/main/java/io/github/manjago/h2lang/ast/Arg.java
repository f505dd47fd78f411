package io.github.manjago.h2lang.ast;

import java.util.List;

/**
 * Argument at a call site. The shape is decided syntactically; whether a
 * bare parameter argument carries commands or a number is only known while
 * expanding.
 */
public sealed interface Arg {

    Span span();

    /** Command-sequence argument, possibly empty ({@code f(s,)}). */
    record CommandArg(Expr expr) implements Arg {
        @Override
        public Span span() {
            return expr.span();
        }
    }

    /** Signed integer literal. Range is checked at expansion time. */
    record NumberArg(int value, Span span) implements Arg {}

    /** {@code first (op atom)*}, e.g. {@code X-1} or {@code 10-3+1}. */
    record NumExprArg(NumAtom first, List<NumTerm> rest, Span span) implements Arg {
        public NumExprArg {
            rest = List.copyOf(rest);
        }
    }

    /** One {@code (op atom)} step of a numeric expression. */
    record NumTerm(NumOp op, NumAtom atom) {}
}
