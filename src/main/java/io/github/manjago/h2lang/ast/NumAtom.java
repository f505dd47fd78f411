package io.github.manjago.h2lang.ast;

/**
 * Operand of a numeric argument expression.
 */
public sealed interface NumAtom {

    record Literal(int value) implements NumAtom {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record ParamAtom(char name) implements NumAtom {
        @Override
        public String toString() {
            return String.valueOf(name);
        }
    }
}
