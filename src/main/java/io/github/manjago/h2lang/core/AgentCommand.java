package io.github.manjago.h2lang.core;

/**
 * Command one agent executes at a given timeline step.
 */
public record AgentCommand(int agentId, Command command) {

    @Override
    public String toString() {
        return "#" + agentId + " " + command.letter();
    }
}
