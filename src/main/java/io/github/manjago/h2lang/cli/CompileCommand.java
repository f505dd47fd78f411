package io.github.manjago.h2lang.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.h2lang.config.CompilerConfig;
import io.github.manjago.h2lang.core.CompileResult;
import io.github.manjago.h2lang.core.ExpansionListener;
import io.github.manjago.h2lang.core.H2Compiler;
import io.github.manjago.h2lang.debug.TimelinePrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: compile
 *
 * Compiles a program and prints every agent's commands.
 *
 * Usage:
 *   h2 compile square.h2
 *   h2 compile swarm.h2 --timeline --compact
 *   h2 compile deep.h2 --config limits.conf --trace
 */
@Command(
    name = "compile",
    description = "Compile a program and print the commands",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path inputFile;

    @Option(names = {"-t", "--timeline"}, description = "Also print the step-by-step timeline")
    private boolean timeline;

    @Option(names = {"--compact"}, description = "Print command letters only")
    private boolean compact;

    @Option(names = {"-c", "--config"}, description = "Config file (HOCON)")
    private Path configFile;

    @Option(names = {"--trace"}, description = "Trace calls to stderr")
    private boolean trace;

    @Override
    public Integer call() {
        CompilerConfig config;
        try {
            config = configFile != null
                    ? CompilerConfig.fromFile(configFile)
                    : CompilerConfig.defaults();
        } catch (ConfigException e) {
            System.err.println("❌ Config error: " + e.getMessage());
            return 1;
        }

        String source;
        try {
            source = SourceFiles.read(inputFile);
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + inputFile + ": " + e.getMessage());
            return 1;
        }

        ExpansionListener listener = trace ? new ConsoleTraceListener() : ExpansionListener.NOOP;
        CompileResult result = new H2Compiler(config, listener).compile(source);

        if (!result.isSuccess()) {
            new TimelinePrinter(System.err).print(result);
            return 1;
        }

        new TimelinePrinter(System.out)
                .showTimeline(timeline || config.showTimeline())
                .compactMode(compact || config.compact())
                .print(result);
        return 0;
    }

    /**
     * Writes expansion events to stderr.
     */
    private static class ConsoleTraceListener implements ExpansionListener {

        @Override
        public void onCall(int agentId, char name, int depth) {
            System.err.printf("[agent %d] %s%c%n", agentId, "  ".repeat(depth), name);
        }

        @Override
        public void onTruncate(int agentId, int steps) {
            System.err.printf("[agent %d] truncated after %,d steps%n", agentId, steps);
        }

        @Override
        public void onAgentExpanded(int agentId, int commandCount) {
            System.err.printf("[agent %d] %,d commands%n", agentId, commandCount);
        }
    }
}
