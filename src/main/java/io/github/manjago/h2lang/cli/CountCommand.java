package io.github.manjago.h2lang.cli;

import io.github.manjago.h2lang.core.CompileError;
import io.github.manjago.h2lang.core.GolfByteCounter;
import io.github.manjago.h2lang.core.H2Exception;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: count
 *
 * Prints the golf byte count of a program.
 */
@Command(
    name = "count",
    description = "Print the golf byte count of a program",
    mixinStandardHelpOptions = true
)
public class CountCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path inputFile;

    @Override
    public Integer call() {
        try {
            System.out.println(GolfByteCounter.count(SourceFiles.read(inputFile)));
            return 0;
        } catch (H2Exception e) {
            System.err.println(CompileError.from(e));
            return 1;
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + inputFile + ": " + e.getMessage());
            return 1;
        }
    }
}
