package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Agent;
import io.github.manjago.h2lang.ast.FuncDef;
import io.github.manjago.h2lang.ast.LimitConfig;
import io.github.manjago.h2lang.ast.OnLimit;
import io.github.manjago.h2lang.ast.Span;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one agent's expansion.
 * <p>
 * Owns the agent's definition table, the step counter and the truncated flag.
 * Every recursive expansion step of the agent shares the same session, so a
 * limit reached deep inside recursion stops the whole agent at exactly the
 * {@code MAX_STEP}-th command. Not thread-safe; one session per agent.
 */
public class ExpansionSession {

    private final int agentId;
    private final Map<Character, FuncDef> functions = new HashMap<>();
    private final LimitConfig limits;
    private final ExpansionListener listener;

    private int steps = 0;
    private boolean truncated = false;

    public ExpansionSession(Agent agent, LimitConfig limits, ExpansionListener listener) {
        this.agentId = agent.id();
        this.limits = limits;
        this.listener = listener;

        // A later definition with the same name replaces the earlier one
        for (FuncDef def : agent.definitions()) {
            functions.put(def.name(), def);
        }
    }

    /**
     * Append a command unless the step limit has been reached.
     *
     * @param command command to emit
     * @param span    source position blamed if the limit aborts expansion
     * @param out     receives the command
     * @throws Expander.ExpandException under {@link OnLimit#ERROR} when the limit is reached (E004)
     */
    public void emit(Command command, Span span, List<Command> out) throws Expander.ExpandException {
        if (steps >= limits.maxStep()) {
            if (limits.onLimit() == OnLimit.ERROR) {
                throw new Expander.ExpandException(
                        "[E004] MAX_STEP limit (" + limits.maxStep() + ") exceeded", span);
            }
            if (!truncated) {
                truncated = true;
                listener.onTruncate(agentId, steps);
            }
            return;
        }
        steps++;
        out.add(command);
    }

    public @Nullable FuncDef lookup(char name) {
        return functions.get(name);
    }

    public int agentId() {
        return agentId;
    }

    public LimitConfig limits() {
        return limits;
    }

    public ExpansionListener listener() {
        return listener;
    }

    /**
     * Commands counted so far, including those generated while evaluating arguments.
     */
    public int steps() {
        return steps;
    }

    public boolean isTruncated() {
        return truncated;
    }
}
