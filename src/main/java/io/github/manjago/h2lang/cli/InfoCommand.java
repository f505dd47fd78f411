package io.github.manjago.h2lang.cli;

import io.github.manjago.h2lang.config.CompilerConfig;
import io.github.manjago.h2lang.core.H2Compiler;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about the compiler.
 */
@Command(
    name = "info",
    description = "Show version and default configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║                  H2                   ║");
        System.out.println("║     Swarm Movement Language           ║");
        System.out.println("║          Version " + H2Compiler.VERSION + "                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(CompilerConfig.defaults());

        System.out.println("Commands: s (straight), r (right 90°), l (left 90°)");
        System.out.println("Directives: MAX_STEP, MAX_DEPTH, MAX_MEMORY, ON_LIMIT=ERROR|TRUNCATE");
        return 0;
    }
}
