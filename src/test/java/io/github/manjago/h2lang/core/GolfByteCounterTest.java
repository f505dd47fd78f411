package io.github.manjago.h2lang.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GolfByteCounter.
 */
class GolfByteCounterTest {

    @Test
    @DisplayName("Letters count one each")
    void testLetters() throws Exception {
        assertEquals(3, GolfByteCounter.count("srl"));
        assertEquals(11, GolfByteCounter.count("f(X,Y):XYf(X,Y) f(s,r)"));
    }

    @Test
    @DisplayName("Numbers count once regardless of digits")
    void testNumbers() throws Exception {
        assertEquals(8, GolfByteCounter.count("a(X):sa(X-1) a(4)"));
        assertEquals(10, GolfByteCounter.count("f(X):sf(X-1+2-3) f(10)"));
        assertEquals(2, GolfByteCounter.count("a(255)"));
    }

    @Test
    @DisplayName("Agent IDs, blanks and comments are free")
    void testFreeTokens() throws Exception {
        assertEquals(6, GolfByteCounter.count("0: srl  # three\n1: lrs"));
        assertEquals(4, GolfByteCounter.count("f():ss f()"));
    }

    @Test
    @DisplayName("Directive lines are free")
    void testDirectives() throws Exception {
        assertEquals(3, GolfByteCounter.count("MAX_STEP=100\nON_LIMIT=TRUNCATE\nsrl"));
    }

    @Test
    @DisplayName("Empty program")
    void testEmpty() throws Exception {
        assertEquals(0, GolfByteCounter.count(""));
        assertEquals(0, GolfByteCounter.count("   \n\t"));
    }

    @Test
    @DisplayName("Source must parse")
    void testInvalid() {
        assertThrows(Parser.ParseException.class, () -> GolfByteCounter.count("f(X):Xf(X-1)"));
        assertThrows(Parser.ParseException.class, () -> GolfByteCounter.count(":(),+-"));
        assertThrows(Parser.ParseException.class, () -> GolfByteCounter.count("f(X:X"));
        assertThrows(Parser.ParseException.class, () -> GolfByteCounter.count("INVALID_DIRECTIVE=100"));
        assertThrows(Lexer.LexerException.class, () -> GolfByteCounter.count("s/r"));
    }
}
