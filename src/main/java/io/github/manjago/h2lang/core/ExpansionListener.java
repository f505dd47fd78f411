package io.github.manjago.h2lang.core;

/**
 * Listener for expansion events.
 * <p>
 * Implement this interface to trace calls, for example to log them or to
 * collect statistics. Methods are called one at a time from the expansion
 * worker thread; {@link Expander#expandAgent} returns after the last call.
 */
public interface ExpansionListener {

    /**
     * Called before a macro or function body is expanded.
     *
     * @param agentId agent being expanded
     * @param name    called definition
     * @param depth   nesting depth of the call site
     */
    default void onCall(int agentId, char name, int depth) {}

    /**
     * Called once when an agent hits MAX_STEP under the TRUNCATE policy.
     *
     * @param agentId agent being expanded
     * @param steps   commands generated so far
     */
    default void onTruncate(int agentId, int steps) {}

    /**
     * Called after an agent expanded successfully.
     *
     * @param agentId      expanded agent
     * @param commandCount length of its command list
     */
    default void onAgentExpanded(int agentId, int commandCount) {}

    /**
     * No-op listener that does nothing.
     */
    ExpansionListener NOOP = new ExpansionListener() {};
}
