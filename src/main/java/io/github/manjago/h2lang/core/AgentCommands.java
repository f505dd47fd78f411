package io.github.manjago.h2lang.core;

import java.util.List;

/**
 * Expanded command list of one agent, as fed to the {@link Scheduler}.
 */
public record AgentCommands(int agentId, List<Command> commands) {

    public AgentCommands {
        commands = List.copyOf(commands);
    }

    public int size() {
        return commands.size();
    }
}
