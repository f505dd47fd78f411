package io.github.manjago.h2lang.cli;

import io.github.manjago.h2lang.core.H2Compiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * H2 CLI - compiler for the H2 swarm movement language.
 *
 * Usage:
 *   h2 compile <file> [--timeline]   - Compile and print commands
 *   h2 validate <file>               - Check syntax only
 *   h2 count <file>                  - Print golf byte count
 *   h2 info                          - Show version and default limits
 */
@Command(
    name = "h2",
    description = "Compiler for the H2 swarm movement language",
    mixinStandardHelpOptions = true,
    version = "H2 " + H2Compiler.VERSION,
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        CountCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class H2Cli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new H2Cli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
