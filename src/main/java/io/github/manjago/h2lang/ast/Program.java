package io.github.manjago.h2lang.ast;

import java.util.List;

/**
 * Parsed program. Immutable.
 */
public record Program(List<Directive> directives, LimitConfig limits, List<Agent> agents) {

    public Program {
        directives = List.copyOf(directives);
        agents = List.copyOf(agents);
    }
}
