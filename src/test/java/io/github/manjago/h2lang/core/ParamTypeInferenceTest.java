package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Expr;
import io.github.manjago.h2lang.ast.FuncDef;
import io.github.manjago.h2lang.ast.ParamType;
import io.github.manjago.h2lang.ast.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParamTypeInference.
 */
class ParamTypeInferenceTest {

    private static FuncDef define(String source) throws Exception {
        return new Parser(source).parseProgram().agents().get(0).definitions().get(0);
    }

    @Test
    @DisplayName("Parameter used as a term is a command sequence")
    void testCommandSequence() throws Exception {
        assertEquals(ParamType.COMMAND_SEQUENCE, define("f(X):XXX").typeOf('X'));
    }

    @Test
    @DisplayName("Parameter used in arithmetic is an integer")
    void testInteger() throws Exception {
        assertEquals(ParamType.INTEGER, define("a(X):sa(X-1)").typeOf('X'));
    }

    @Test
    @DisplayName("Mixed parameters")
    void testMixed() throws Exception {
        FuncDef def = define("a(X,Y):Ya(X-1,Y)");
        assertEquals(ParamType.INTEGER, def.typeOf('X'));
        assertEquals(ParamType.COMMAND_SEQUENCE, def.typeOf('Y'));
    }

    @Test
    @DisplayName("Forwarding a bare parameter does not constrain it")
    void testPassThrough() throws Exception {
        FuncDef def = define("f(X):g(X)");
        assertEquals(ParamType.COMMAND_SEQUENCE, def.typeOf('X'));
    }

    @Test
    @DisplayName("Forwarded parameter also used in arithmetic stays an integer")
    void testPassThroughWithArithmetic() throws Exception {
        assertEquals(ParamType.INTEGER, define("f(X):g(X)f(X-1)").typeOf('X'));
    }

    @Test
    @DisplayName("Term inside a command argument counts as a term")
    void testTermInsideArgument() throws Exception {
        assertEquals(ParamType.COMMAND_SEQUENCE, define("f(X):g(sX)").typeOf('X'));
    }

    @Test
    @DisplayName("Parameter in a later numeric atom")
    void testLaterAtom() throws Exception {
        assertEquals(ParamType.INTEGER, define("f(X):g(1+X)").typeOf('X'));
    }

    @Test
    @DisplayName("Free parameters are ignored")
    void testFreeParameter() throws Exception {
        FuncDef def = define("f(X):Xg(Y-1)");
        assertEquals(Map.of('X', ParamType.COMMAND_SEQUENCE), def.paramTypes());
    }

    @Test
    @DisplayName("Both roles is a type conflict")
    void testConflict() {
        Parser.ParseException e = assertThrows(Parser.ParseException.class, () -> define("f(X):Xf(X-1)"));
        assertTrue(e.getMessage().startsWith("Type conflict: parameter 'X' of 'f'"), e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
    }

    @Test
    @DisplayName("Inference on a hand-built body")
    void testDirectInference() throws Exception {
        Expr body = new Expr.Sequence(List.of(
                new Expr.ParamRef('A', Span.DEFAULT),
                new Expr.ParamRef('B', Span.DEFAULT)));
        Map<Character, ParamType> types = ParamTypeInference.infer('h', List.of('A', 'B', 'C'), body);
        assertEquals(3, types.size());
        assertEquals(ParamType.COMMAND_SEQUENCE, types.get('C'));
    }
}
