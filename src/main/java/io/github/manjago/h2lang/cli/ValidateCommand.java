package io.github.manjago.h2lang.cli;

import io.github.manjago.h2lang.core.CompileResult;
import io.github.manjago.h2lang.core.H2Compiler;
import io.github.manjago.h2lang.debug.TimelinePrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: validate
 *
 * Lexes and parses a program without expanding it.
 */
@Command(
    name = "validate",
    description = "Check a program's syntax",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path inputFile;

    @Override
    public Integer call() {
        try {
            CompileResult result = new H2Compiler().validate(SourceFiles.read(inputFile));
            if (!result.isSuccess()) {
                new TimelinePrinter(System.err).print(result);
                return 1;
            }
            System.out.println("✓ " + inputFile + " is valid");
            return 0;
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + inputFile + ": " + e.getMessage());
            return 1;
        }
    }
}
