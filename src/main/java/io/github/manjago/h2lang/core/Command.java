package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Primitive;

/**
 * Fully resolved robot command, the unit the scheduler and printers consume.
 */
public enum Command {

    STRAIGHT('s', 0),
    RIGHT('r', 90),
    LEFT('l', -90);

    private final char letter;
    private final int angle;

    Command(char letter, int angle) {
        this.letter = letter;
        this.angle = angle;
    }

    public static Command from(Primitive primitive) {
        return switch (primitive) {
            case STRAIGHT -> STRAIGHT;
            case RIGHT -> RIGHT;
            case LEFT -> LEFT;
        };
    }

    public char letter() {
        return letter;
    }

    /**
     * Turn in degrees, clockwise positive. 0 for a forward move.
     */
    public int angle() {
        return angle;
    }

    /**
     * Commands as a string of letters, e.g. {@code "srl"}.
     */
    public static String toLetters(Iterable<Command> commands) {
        StringBuilder sb = new StringBuilder();
        for (Command command : commands) {
            sb.append(command.letter);
        }
        return sb.toString();
    }
}
