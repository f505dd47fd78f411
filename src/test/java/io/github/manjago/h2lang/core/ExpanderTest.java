package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Expander.
 */
class ExpanderTest {

    private static List<Command> expand(String source, ExpansionListener listener) throws Exception {
        Program program = new Parser(source).parseProgram();
        return new Expander(program.limits(), listener).expandAgent(program.agents().get(0));
    }

    private static String letters(String source) throws Exception {
        return Command.toLetters(expand(source, ExpansionListener.NOOP));
    }

    private static Expander.ExpandException expandError(String source) {
        return assertThrows(Expander.ExpandException.class, () -> letters(source));
    }

    @Nested
    @DisplayName("Basic expansion")
    class Basic {

        @Test
        @DisplayName("Primitives")
        void testPrimitives() throws Exception {
            assertEquals(List.of(Command.STRAIGHT, Command.RIGHT, Command.LEFT),
                    expand("srl", ExpansionListener.NOOP));
        }

        @Test
        @DisplayName("Macro")
        void testMacro() throws Exception {
            assertEquals("ssrss", letters("0: x:ss xrx"));
        }

        @Test
        @DisplayName("Command parameter")
        void testFunction() throws Exception {
            assertEquals("sss", letters("0: f(X):XXX f(s)"));
        }

        @Test
        @DisplayName("Nested calls")
        void testNested() throws Exception {
            assertEquals("srsr", letters("f(X):XX g(Y):f(Y) g(sr)"));
        }

        @Test
        @DisplayName("Grouping")
        void testGroup() throws Exception {
            assertEquals("srl", letters("(s(r))l"));
        }

        @Test
        @DisplayName("Later definition with the same name wins")
        void testRedefinition() throws Exception {
            assertEquals("r", letters("x:s x:r x"));
        }

        @Test
        @DisplayName("Macro sees the caller's bindings")
        void testDynamicBinding() throws Exception {
            assertEquals("s", letters("g:X f(X):g f(s)"));
        }

        @Test
        @DisplayName("Expansion is deterministic")
        void testDeterministic() throws Exception {
            String source = "a(X,Y):Ya(X-1,Yr) a(5,s)";
            assertEquals(letters(source), letters(source));
        }
    }

    @Nested
    @DisplayName("Numeric recursion")
    class Numeric {

        @Test
        @DisplayName("Counts down to zero")
        void testCountdown() throws Exception {
            assertEquals("ssss", letters("0: a(X):sa(X-1) a(4)"));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, -255})
        @DisplayName("Non-positive argument gives nothing")
        void testNonPositive(int n) throws Exception {
            assertEquals("", letters("a(X):sa(X-1) a(" + n + ")"));
        }

        @Test
        @DisplayName("One iteration")
        void testOne() throws Exception {
            assertEquals("s", letters("a(X):sa(X-1) a(1)"));
        }

        @Test
        @DisplayName("Square")
        void testSquare() throws Exception {
            assertEquals("ssssr".repeat(4), letters("f(X):ssssrf(X-1) f(4)"));
        }

        @Test
        @DisplayName("Count with a command argument")
        void testCountAndCommands() throws Exception {
            assertEquals("srsrsr", letters("a(X,Y):Ya(X-1,Y) a(3,sr)"));
            assertEquals("", letters("a(X,Y):Ya(X-1,Y) a(0,s)"));
        }

        @Test
        @DisplayName("Growing command argument")
        void testGrowingArgument() throws Exception {
            assertEquals("s" + "sr" + "srr", letters("a(X,Y):Ya(X-1,Yr) a(3,s)"));
        }

        @Test
        @DisplayName("Integer forwarded through a bare parameter")
        void testIntegerPassThrough() throws Exception {
            assertEquals("srsr", letters("b(Y):ra(Y-1) a(X):sb(X) a(2)"));
        }

        @Test
        @DisplayName("Multi-term expressions")
        void testMultiTerm() throws Exception {
            assertEquals("sssss", letters("a(X):sa(X-1) a(2+3)"));
            assertEquals("s".repeat(8), letters("a(X):sa(X-1) a(10-3+1)"));
            assertEquals("sssss", letters("f(X):sf(X-1+2-3) f(10)"));
        }

        @Test
        @DisplayName("Defaults for a call without arguments")
        void testDefaults() throws Exception {
            assertEquals("s", letters("f(X):sX f()"));
            assertEquals("", letters("a(X):sa(X-1) a()"));
        }

        @Test
        @DisplayName("Recursion exactly at MAX_DEPTH")
        void testDepthBoundary() throws Exception {
            assertEquals(100, letters("a(X):sa(X-1) a(100)").length());
            expandError("a(X):sa(X-1) a(101)");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Undefined macro")
        void testUndefinedMacro() {
            Expander.ExpandException e = expandError("srx");
            assertEquals("Undefined macro 'x'", e.getMessage());
            assertEquals(3, e.getColumn());
        }

        @Test
        @DisplayName("Undefined function")
        void testUndefinedFunction() {
            assertEquals("Undefined function 'f'", expandError("f(s)").getMessage());
        }

        @Test
        @DisplayName("Argument count mismatch")
        void testArity() {
            assertEquals("Function 'f' expects 1 argument(s), got 2",
                    expandError("f(X):X f(s,r)").getMessage());
        }

        @Test
        @DisplayName("Literal out of range")
        void testLiteralRange() {
            assertEquals("[E007] Numeric value 256 out of range (-255..255)",
                    expandError("a(X):sa(X-1) a(256)").getMessage());
            assertTrue(expandError("a(X):sa(X-1) a(-256)").getMessage().startsWith("[E007]"));
        }

        @Test
        @DisplayName("Intermediate result out of range")
        void testIntermediateRange() {
            assertTrue(expandError("a(X):sa(X-1) a(200+100-50)").getMessage().contains("300"));
            assertTrue(expandError("a(X):sa(X+1) a(250)").getMessage().contains("256"));
        }

        @Test
        @DisplayName("Integer used as a command sequence")
        void testIntegerAsCommands() {
            assertTrue(expandError("f(X):X f(3)").getMessage().startsWith("[E008]"));
        }

        @Test
        @DisplayName("Command sequence used in arithmetic")
        void testCommandsAsInteger() {
            assertTrue(expandError("a(X):sa(X-1) a(s)").getMessage().startsWith("[E008]"));
        }

        @Test
        @DisplayName("Undefined parameter")
        void testUndefinedParameter() {
            assertEquals("Undefined parameter 'Y'", expandError("f(X):sY f(s)").getMessage());
        }

        @Test
        @DisplayName("Unbounded recursion hits MAX_DEPTH")
        void testDepth() {
            assertEquals("Maximum recursion depth exceeded", expandError("MAX_DEPTH=5\nf:sf f").getMessage());
        }

        @Test
        @DisplayName("Depth is fatal under TRUNCATE as well")
        void testDepthIgnoresTruncate() {
            expandError("MAX_DEPTH=5\nON_LIMIT=TRUNCATE\nf:sf f");
        }
    }

    @Nested
    @DisplayName("Step limit")
    class StepLimit {

        @Test
        @DisplayName("ERROR aborts")
        void testError() {
            assertEquals("[E004] MAX_STEP limit (3) exceeded",
                    expandError("MAX_STEP=3\nON_LIMIT=ERROR\n0: a(X):sa(X-1) a(10)").getMessage());
        }

        @Test
        @DisplayName("TRUNCATE keeps exactly MAX_STEP commands")
        void testTruncate() throws Exception {
            assertEquals("sss", letters("MAX_STEP=3\nON_LIMIT=TRUNCATE\n0: a(X):sa(X-1) a(10)"));
        }

        @Test
        @DisplayName("Output equal to the limit is not an error")
        void testExactBoundary() throws Exception {
            assertEquals("ssss", letters("MAX_STEP=4\nON_LIMIT=ERROR\na(X):sa(X-1) a(4)"));
            expandError("MAX_STEP=3\nON_LIMIT=ERROR\na(X):sa(X-1) a(4)");
        }

        @Test
        @DisplayName("Truncation stops the rest of the sequence")
        void testTruncateSequence() throws Exception {
            assertEquals("sr", letters("MAX_STEP=2\nsrlsrl"));
        }

        @Test
        @DisplayName("Commands built for arguments count as steps")
        void testArgumentSteps() throws Exception {
            assertEquals("ss", letters("MAX_STEP=3\nf(X):XXX f(s)"));
        }

        @Test
        @DisplayName("Listener sees calls and one truncation")
        void testListener() throws Exception {
            List<String> events = new ArrayList<>();
            ExpansionListener listener = new ExpansionListener() {
                @Override
                public void onCall(int agentId, char name, int depth) {
                    events.add("call " + name + "@" + depth);
                }

                @Override
                public void onTruncate(int agentId, int steps) {
                    events.add("truncate " + steps);
                }

                @Override
                public void onAgentExpanded(int agentId, int commandCount) {
                    events.add("done " + commandCount);
                }
            };

            expand("MAX_STEP=2\na(X):sa(X-1) a(5)", listener);
            assertEquals(List.of("call a@0", "call a@1", "call a@2", "truncate 2", "done 2"), events);
        }
    }

    @Nested
    @DisplayName("Deep recursion")
    class DeepRecursion {

        @Test
        @DisplayName("Macro recursion runs to MAX_STEP at the largest depth limit")
        void testDeepMacro() throws Exception {
            String result = letters("MAX_DEPTH=10000\nMAX_STEP=9000\nON_LIMIT=TRUNCATE\na:sa a");
            assertEquals(9000, result.length());
            assertEquals("s".repeat(9000), result);
        }

        @Test
        @DisplayName("Function recursion with a forwarded argument runs to MAX_STEP")
        void testDeepFunction() throws Exception {
            // One step goes to evaluating the initial argument
            assertEquals(8999, letters("MAX_DEPTH=10000\nMAX_STEP=9000\nON_LIMIT=TRUNCATE\nf(X):sf(X) f(s)").length());
        }

        @Test
        @DisplayName("Depth counter still ends unbounded recursion past the old stack limit")
        void testDepthLimitAt2000() {
            Expander.ExpandException e = expandError("MAX_DEPTH=2000\nMAX_STEP=100000\na:sa a");
            assertEquals("Maximum recursion depth exceeded", e.getDetail());
        }

        @Test
        @DisplayName("Worker stack grows with the depth limit")
        void testStackBytes() {
            assertTrue(Expander.stackBytes(10_000) > Expander.stackBytes(100));
        }
    }
}
