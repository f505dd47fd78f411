package io.github.manjago.h2lang.debug;

import io.github.manjago.h2lang.core.AgentCommand;
import io.github.manjago.h2lang.core.Command;
import io.github.manjago.h2lang.core.CompileResult;
import io.github.manjago.h2lang.core.H2Compiler;
import io.github.manjago.h2lang.core.TimelineStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TimelinePrinter.
 */
class TimelinePrinterTest {

    private ByteArrayOutputStream buffer;
    private TimelinePrinter printer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        printer = new TimelinePrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static CompileResult compile(String source) {
        return new H2Compiler().compile(source);
    }

    @Test
    @DisplayName("Listing")
    void testListing() {
        printer.print(compile("0: srl\n1: ls"));
        assertEquals("agent 0: srl (3 commands)\nagent 1: ls (2 commands)\n", output());
    }

    @Test
    @DisplayName("Timeline")
    void testTimeline() {
        printer.showTimeline(true).print(compile("0: srl\n1: ls"));
        assertEquals("""
                agent 0: srl (3 commands)
                agent 1: ls (2 commands)

                0000: #0 s  #1 l
                0001: #0 r  #1 s
                0002: #0 l
                """, output());
    }

    @Test
    @DisplayName("Compact mode")
    void testCompact() {
        printer.showTimeline(true).compactMode(true).print(compile("0: sr\n1: l"));
        assertEquals("sr\nl\n\nsl\nr\n", output());
    }

    @Test
    @DisplayName("Errors")
    void testErrors() {
        printer.print(compile("srx"));
        assertEquals("1:3: Undefined macro 'x'\n", output());
    }

    @Test
    @DisplayName("Steps past 9999 keep the separator layout")
    void testWideStepNumber() {
        printer.printTimeline(List.of(new TimelineStep(10000,
                List.of(new AgentCommand(0, Command.STRAIGHT), new AgentCommand(1, Command.RIGHT)))));
        assertEquals("10000: #0 s  #1 r\n", output());
    }
}
