package io.github.manjago.h2lang.core;

import java.util.List;

/**
 * Value bound to a parameter while a call is being expanded.
 */
public sealed interface ParamValue {

    record Commands(List<Command> commands) implements ParamValue {
        public Commands {
            commands = List.copyOf(commands);
        }

        static final Commands EMPTY = new Commands(List.of());
    }

    record Number(int value) implements ParamValue {}
}
