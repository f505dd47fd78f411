package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Expands an agent's expression tree into a flat command list.
 *
 * <h2>Rules:</h2>
 * <pre>
 * s r l          one command each, metered by MAX_STEP
 * x              call of macro x
 * f(A,B)         body of f with parameters bound to the evaluated arguments
 * f()            parameters take defaults: empty commands, integer 0
 * X              commands bound to X (integers are a type error)
 * </pre>
 * An integer argument of 0 or less ends the call with no output. This is
 * the base case of numeric recursion such as {@code a(X):sa(X-1) a(4)}.
 * <p>
 * Bindings are dynamic: the callee sees the caller's bindings with its own
 * parameters laid over them.
 */
public class Expander {

    private static final Logger log = LoggerFactory.getLogger(Expander.class);

    /** Inclusive range of numeric literals and intermediate results. */
    public static final int NUMERIC_MIN = -255;
    public static final int NUMERIC_MAX = 255;

    // Worker stack: base plus an allowance per depth level, nested arguments included
    private static final long BASE_STACK_BYTES = 1024 * 1024;
    private static final long STACK_BYTES_PER_LEVEL = 8 * 1024;

    private final LimitConfig limits;
    private final ExpansionListener listener;

    public Expander(LimitConfig limits) {
        this(limits, ExpansionListener.NOOP);
    }

    public Expander(LimitConfig limits, ExpansionListener listener) {
        this.limits = limits;
        this.listener = listener;
    }

    /**
     * Expand one agent in a fresh session.
     * <p>
     * The walk runs on a worker thread whose stack is sized for the
     * configured {@code MAX_DEPTH}, so only the depth counter ends a deep
     * recursion. The calling thread waits for the result.
     *
     * @return commands in execution order
     * @throws ExpandException on the first expansion error
     */
    public List<Command> expandAgent(Agent agent) throws ExpandException {
        AtomicReference<List<Command>> result = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread worker = new Thread(null, () -> {
            try {
                result.set(expandOnCurrentThread(agent));
            } catch (StackOverflowError e) {
                failure.set(new ExpandException("Expression nesting exceeds the expansion stack", agent.span()));
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "h2-expand-" + agent.id(), stackBytes(limits.maxDepth()));

        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            worker.interrupt();
            Thread.currentThread().interrupt();
            throw new ExpandException("Expansion of agent " + agent.id() + " interrupted", agent.span());
        }

        Throwable t = failure.get();
        if (t instanceof ExpandException e) {
            throw e;
        }
        if (t instanceof RuntimeException e) {
            throw e;
        }
        if (t instanceof Error e) {
            throw e;
        }
        return result.get();
    }

    /**
     * Worker stack for a given depth limit: a fixed base plus a per-level allowance.
     */
    static long stackBytes(int maxDepth) {
        return BASE_STACK_BYTES + STACK_BYTES_PER_LEVEL * (maxDepth + 1L);
    }

    private List<Command> expandOnCurrentThread(Agent agent) throws ExpandException {
        ExpansionSession session = new ExpansionSession(agent, limits, listener);
        List<Command> out = new ArrayList<>();

        expand(agent.expression(), session, 0, Map.of(), out);

        if (session.isTruncated()) {
            log.debug("Agent {} truncated at {} step(s)", agent.id(), session.steps());
        }
        log.debug("Agent {} expanded to {} command(s)", agent.id(), out.size());
        listener.onAgentExpanded(agent.id(), out.size());
        return List.copyOf(out);
    }

    // ========== Expressions ==========

    private void expand(Expr expr, ExpansionSession session, int depth,
                        Map<Character, ParamValue> bindings, List<Command> out) throws ExpandException {
        if (depth > session.limits().maxDepth()) {
            throw new ExpandException("Maximum recursion depth exceeded", expr.span());
        }
        if (session.isTruncated()) {
            return;
        }

        if (expr instanceof Expr.PrimitiveExpr primitive) {
            session.emit(Command.from(primitive.primitive()), primitive.span(), out);
        } else if (expr instanceof Expr.ParamRef ref) {
            expandParam(ref, session, bindings, out);
        } else if (expr instanceof Expr.Identifier identifier) {
            FuncDef def = session.lookup(identifier.name());
            if (def == null) {
                throw new ExpandException("Undefined macro '" + identifier.name() + "'", identifier.span());
            }
            expandCall(def, List.of(), identifier.span(), session, depth, bindings, out);
        } else if (expr instanceof Expr.FunctionCall call) {
            FuncDef def = session.lookup(call.name());
            if (def == null) {
                throw new ExpandException("Undefined function '" + call.name() + "'", call.span());
            }
            expandCall(def, call.args(), call.span(), session, depth, bindings, out);
        } else if (expr instanceof Expr.Sequence sequence) {
            for (Expr child : sequence.children()) {
                if (session.isTruncated()) {
                    break;
                }
                expand(child, session, depth, bindings, out);
            }
        }
    }

    private void expandParam(Expr.ParamRef ref, ExpansionSession session,
                             Map<Character, ParamValue> bindings, List<Command> out) throws ExpandException {
        ParamValue value = bindings.get(ref.name());
        if (value == null) {
            throw new ExpandException("Undefined parameter '" + ref.name() + "'", ref.span());
        }
        if (value instanceof ParamValue.Number) {
            throw new ExpandException("[E008] Parameter '" + ref.name()
                    + "' is an integer but used as a command sequence", ref.span());
        }
        for (Command command : ((ParamValue.Commands) value).commands()) {
            session.emit(command, ref.span(), out);
            if (session.isTruncated()) {
                break;
            }
        }
    }

    private void expandCall(FuncDef def, List<Arg> args, Span span, ExpansionSession session, int depth,
                            Map<Character, ParamValue> bindings, List<Command> out) throws ExpandException {
        session.listener().onCall(session.agentId(), def.name(), depth);

        Map<Character, ParamValue> callee = new HashMap<>(bindings);

        if (args.isEmpty()) {
            for (Character param : def.params()) {
                if (def.typeOf(param) == ParamType.INTEGER) {
                    // Default 0 ends the call
                    return;
                }
                callee.put(param, ParamValue.Commands.EMPTY);
            }
        } else {
            if (args.size() != def.arity()) {
                throw new ExpandException(String.format("Function '%c' expects %d argument(s), got %d",
                        def.name(), def.arity(), args.size()), span);
            }
            for (int i = 0; i < args.size(); i++) {
                ParamValue value = evalArg(args.get(i), session, depth, bindings);
                if (value instanceof ParamValue.Number number && number.value() <= 0) {
                    return;
                }
                callee.put(def.params().get(i), value);
            }
        }

        expand(def.body(), session, depth + 1, callee, out);
    }

    // ========== Arguments ==========

    private ParamValue evalArg(Arg arg, ExpansionSession session, int depth,
                               Map<Character, ParamValue> bindings) throws ExpandException {
        if (arg instanceof Arg.CommandArg commandArg) {
            Expr expr = commandArg.expr();
            if (expr instanceof Expr.ParamRef ref && bindings.containsKey(ref.name())) {
                // Forwarded as is, integers included
                return bindings.get(ref.name());
            }
            List<Command> commands = new ArrayList<>();
            expand(expr, session, depth, bindings, commands);
            return new ParamValue.Commands(commands);
        }
        if (arg instanceof Arg.NumberArg number) {
            return new ParamValue.Number(checkRange(number.value(), number.span()));
        }
        Arg.NumExprArg numExpr = (Arg.NumExprArg) arg;
        return new ParamValue.Number(evalNumExpr(numExpr, bindings));
    }

    private int evalNumExpr(Arg.NumExprArg numExpr, Map<Character, ParamValue> bindings) throws ExpandException {
        Span span = numExpr.span();
        int result = checkRange(evalAtom(numExpr.first(), span, bindings), span);
        for (Arg.NumTerm term : numExpr.rest()) {
            int operand = evalAtom(term.atom(), span, bindings);
            result = checkRange(term.op().apply(result, operand), span);
        }
        return result;
    }

    private int evalAtom(NumAtom atom, Span span, Map<Character, ParamValue> bindings) throws ExpandException {
        if (atom instanceof NumAtom.Literal literal) {
            return checkRange(literal.value(), span);
        }
        char name = ((NumAtom.ParamAtom) atom).name();
        ParamValue value = bindings.get(name);
        if (value == null) {
            throw new ExpandException("Undefined parameter '" + name + "'", span);
        }
        if (value instanceof ParamValue.Number number) {
            return number.value();
        }
        throw new ExpandException("[E008] Parameter '" + name
                + "' is a command sequence but used in a numeric expression", span);
    }

    private static int checkRange(int value, Span span) throws ExpandException {
        if (value < NUMERIC_MIN || value > NUMERIC_MAX) {
            throw new ExpandException(String.format("[E007] Numeric value %d out of range (%d..%d)",
                    value, NUMERIC_MIN, NUMERIC_MAX), span);
        }
        return value;
    }

    // ========== Helper classes ==========

    /**
     * Expansion failure: undefined reference, arity, range, type or limit error.
     */
    public static class ExpandException extends H2Exception {

        public ExpandException(String message, Span span) {
            super(message, span);
        }

        @Override
        protected String stage() {
            return "Expansion";
        }
    }
}
