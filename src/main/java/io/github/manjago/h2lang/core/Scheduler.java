package io.github.manjago.h2lang.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges per-agent command lists into a lock-step timeline.
 * <p>
 * Step {@code i} holds the {@code i}-th command of every agent that has one.
 * Shorter agents simply drop out; no wait entries are synthesized.
 */
public final class Scheduler {

    private Scheduler() {
    }

    /**
     * Build the timeline. Pure: equal inputs give equal outputs.
     *
     * @param agents command lists in agent order
     * @return {@link #maxSteps(List)} steps
     */
    public static List<TimelineStep> schedule(List<AgentCommands> agents) {
        int maxLen = maxSteps(agents);
        List<TimelineStep> timeline = new ArrayList<>(maxLen);

        for (int step = 0; step < maxLen; step++) {
            List<AgentCommand> commands = new ArrayList<>(agents.size());
            for (AgentCommands agent : agents) {
                if (step < agent.size()) {
                    commands.add(new AgentCommand(agent.agentId(), agent.commands().get(step)));
                }
            }
            timeline.add(new TimelineStep(step, commands));
        }
        return timeline;
    }

    /**
     * Length of the longest command list, 0 for no agents.
     */
    public static int maxSteps(List<AgentCommands> agents) {
        int max = 0;
        for (AgentCommands agent : agents) {
            max = Math.max(max, agent.size());
        }
        return max;
    }
}
