package io.github.manjago.h2lang.debug;

import io.github.manjago.h2lang.core.AgentCommand;
import io.github.manjago.h2lang.core.CompileError;
import io.github.manjago.h2lang.core.CompileResult;
import io.github.manjago.h2lang.core.CompiledAgent;
import io.github.manjago.h2lang.core.TimelineStep;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints compilation results in human-readable format.
 */
public class TimelinePrinter {

    private final PrintStream out;
    private boolean showTimeline = false;
    private boolean compactMode = false;

    public TimelinePrinter() {
        this(System.out);
    }

    public TimelinePrinter(PrintStream out) {
        this.out = out;
    }

    public TimelinePrinter showTimeline(boolean show) {
        this.showTimeline = show;
        return this;
    }

    public TimelinePrinter compactMode(boolean compact) {
        this.compactMode = compact;
        return this;
    }

    /**
     * Print a result: listing (and timeline if enabled) or errors.
     */
    public void print(CompileResult result) {
        if (result instanceof CompileResult.Success success) {
            printAgents(success.agents());
            if (showTimeline) {
                out.println();
                printTimeline(success.timeline());
            }
        } else {
            printErrors(((CompileResult.Failure) result).errors());
        }
    }

    /**
     * One line per agent.
     */
    public void printAgents(List<CompiledAgent> agents) {
        for (CompiledAgent agent : agents) {
            if (compactMode) {
                out.println(agent.letters());
            } else {
                out.printf("agent %d: %s (%d commands)%n", agent.id(), agent.letters(), agent.commands().size());
            }
        }
    }

    /**
     * One line per step, e.g. {@code 0003: #0 s  #1 r}.
     */
    public void printTimeline(List<TimelineStep> timeline) {
        for (TimelineStep step : timeline) {
            StringBuilder sb = new StringBuilder();
            if (!compactMode) {
                sb.append(String.format("%04d:", step.step()));
            }
            boolean first = true;
            for (AgentCommand entry : step.commands()) {
                if (compactMode) {
                    sb.append(entry.command().letter());
                } else {
                    sb.append(first ? " " : "  ").append(entry);
                }
                first = false;
            }
            out.println(sb);
        }
    }

    public void printErrors(List<CompileError> errors) {
        for (CompileError error : errors) {
            out.println(error);
        }
    }
}
