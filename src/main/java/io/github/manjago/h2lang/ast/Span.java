package io.github.manjago.h2lang.ast;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Source position of a token or tree node.
 * <p>
 * {@code start} and {@code end} are UTF-8 byte offsets ({@code end} exclusive),
 * {@code line} and {@code column} are 1-based and point at the first character.
 */
public record Span(int start, int end, int line, int column) {

    /** Span used for empty sequences and synthesized nodes. */
    public static final Span DEFAULT = new Span(0, 0, 1, 1);

    /**
     * Span running from the start of {@code first} to the end of {@code last}.
     */
    @Contract(pure = true)
    public static @NotNull Span cover(@NotNull Span first, @NotNull Span last) {
        return new Span(first.start, last.end, first.line, first.column);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
