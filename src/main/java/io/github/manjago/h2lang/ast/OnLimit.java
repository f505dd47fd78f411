package io.github.manjago.h2lang.ast;

import org.jetbrains.annotations.Nullable;

/**
 * What the expander does when an agent reaches {@code MAX_STEP}.
 */
public enum OnLimit {

    /** Abort compilation with an E004 error. */
    ERROR,

    /** Stop the agent silently and keep the commands generated so far. */
    TRUNCATE;

    /**
     * Find policy by directive/config spelling (case-insensitive).
     *
     * @return policy, or null if the name is not recognized
     */
    public static @Nullable OnLimit byName(String name) {
        for (OnLimit policy : values()) {
            if (policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        return null;
    }
}
