package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Infers parameter types of one definition from how the body uses them.
 * <p>
 * A parameter written as a term is a command sequence, one written inside a
 * numeric argument is an integer. An argument that is nothing but the bare
 * parameter ({@code f(X)}) forwards whatever value it holds and says nothing
 * about its type. Parameters that are never constrained default to command
 * sequences.
 */
public final class ParamTypeInference {

    private final char function;
    private final List<Character> params;
    private final Map<Character, ParamType> types = new HashMap<>();

    private ParamTypeInference(char function, List<Character> params) {
        this.function = function;
        this.params = params;
    }

    /**
     * Infer a type for every parameter.
     *
     * @param function name of the definition, for messages
     * @param params   declared parameters
     * @param body     definition body
     * @return type of every declared parameter
     * @throws Parser.ParseException if a parameter is used in both roles (E008)
     */
    public static Map<Character, ParamType> infer(char function, List<Character> params, Expr body)
            throws Parser.ParseException {
        ParamTypeInference inference = new ParamTypeInference(function, params);
        inference.visit(body);

        Map<Character, ParamType> result = new HashMap<>();
        for (Character param : params) {
            result.put(param, inference.types.getOrDefault(param, ParamType.COMMAND_SEQUENCE));
        }
        return result;
    }

    private void visit(Expr expr) throws Parser.ParseException {
        if (expr instanceof Expr.ParamRef ref) {
            mark(ref.name(), ParamType.COMMAND_SEQUENCE, ref.span());
        } else if (expr instanceof Expr.FunctionCall call) {
            for (Arg arg : call.args()) {
                visitArg(arg);
            }
        } else if (expr instanceof Expr.Sequence sequence) {
            for (Expr child : sequence.children()) {
                visit(child);
            }
        }
        // Primitives and identifiers carry no parameters
    }

    private void visitArg(Arg arg) throws Parser.ParseException {
        if (arg instanceof Arg.CommandArg commandArg) {
            if (!(commandArg.expr() instanceof Expr.ParamRef)) {
                visit(commandArg.expr());
            }
        } else if (arg instanceof Arg.NumExprArg numExpr) {
            markAtom(numExpr.first(), numExpr.span());
            for (Arg.NumTerm term : numExpr.rest()) {
                markAtom(term.atom(), numExpr.span());
            }
        }
    }

    private void markAtom(NumAtom atom, Span span) throws Parser.ParseException {
        if (atom instanceof NumAtom.ParamAtom param) {
            mark(param.name(), ParamType.INTEGER, span);
        }
    }

    private void mark(char param, ParamType type, Span span) throws Parser.ParseException {
        // Free parameters resolve through the caller's bindings at expansion time
        if (!params.contains(param)) {
            return;
        }
        ParamType previous = types.putIfAbsent(param, type);
        if (previous != null && previous != type) {
            throw new Parser.ParseException(String.format(
                    "Type conflict: parameter '%c' of '%c' is used both as a command sequence and as an integer (E008)",
                    param, function), span);
        }
    }
}
