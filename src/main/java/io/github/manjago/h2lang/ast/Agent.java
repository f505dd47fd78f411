package io.github.manjago.h2lang.ast;

import java.util.List;

/**
 * One independently expanded unit of a program.
 *
 * @param id          agent number ({@code 0} for programs without agent prefixes)
 * @param definitions macros and functions visible only inside this agent
 * @param expression  root expression to execute
 */
public record Agent(int id, List<FuncDef> definitions, Expr expression, Span span) {

    public Agent {
        definitions = List.copyOf(definitions);
    }
}
