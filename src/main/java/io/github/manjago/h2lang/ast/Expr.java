package io.github.manjago.h2lang.ast;

import java.util.List;

/**
 * Expression tree of an agent's root expression or a definition body.
 */
public sealed interface Expr {

    Span span();

    /** One of {@code s}, {@code r}, {@code l}. */
    record PrimitiveExpr(Primitive primitive, Span span) implements Expr {}

    /** Bare reference to a definition, e.g. {@code x} in {@code xrx}. */
    record Identifier(char name, Span span) implements Expr {}

    /** Reference to a parameter bound by the enclosing function. */
    record ParamRef(char name, Span span) implements Expr {}

    /** Call with an argument list, e.g. {@code a(X-1,Y)}. */
    record FunctionCall(char name, List<Arg> args, Span span) implements Expr {
        public FunctionCall {
            args = List.copyOf(args);
        }
    }

    /** Terms executed left to right. */
    record Sequence(List<Expr> children) implements Expr {

        public Sequence {
            children = List.copyOf(children);
        }

        @Override
        public Span span() {
            if (children.isEmpty()) {
                return Span.DEFAULT;
            }
            return Span.cover(children.get(0).span(), children.get(children.size() - 1).span());
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }

    /**
     * Collapse parsed terms: none gives an empty sequence, one is returned as is.
     */
    static Expr of(List<Expr> terms) {
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new Sequence(terms);
    }

    static Expr empty() {
        return new Sequence(List.of());
    }
}
