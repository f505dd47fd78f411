package io.github.manjago.h2lang.core;

import java.util.List;

/**
 * Agent ID with its expanded commands.
 */
public record CompiledAgent(int id, List<Command> commands) {

    public CompiledAgent {
        commands = List.copyOf(commands);
    }

    public String letters() {
        return Command.toLetters(commands);
    }
}
