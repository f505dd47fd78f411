package io.github.manjago.h2lang.core;

import java.util.List;

/**
 * One lock-step tick. Agents whose command lists are already exhausted are absent.
 *
 * @param step     0-based step index
 * @param commands one entry per active agent, in agent order
 */
public record TimelineStep(int step, List<AgentCommand> commands) {

    public TimelineStep {
        commands = List.copyOf(commands);
    }
}
