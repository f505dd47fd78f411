package io.github.manjago.h2lang.ast;

/**
 * A {@code NAME=VALUE} line from the program header.
 */
public record Directive(String name, Value value, Span span) {

    /**
     * Directive value: a number or a bare word such as {@code TRUNCATE}.
     */
    public sealed interface Value {

        record Number(long value) implements Value {
            @Override
            public String toString() {
                return Long.toString(value);
            }
        }

        record Text(String value) implements Value {
            @Override
            public String toString() {
                return value;
            }
        }
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
