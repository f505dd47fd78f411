package io.github.manjago.h2lang.ast;

/**
 * Resource limits applied while expanding one program.
 * <p>
 * Built once by the parser (configured defaults with the program's directives
 * folded over them) and shared read-only by every agent expansion.
 */
public record LimitConfig(
    int maxStep,        // generated primitive ceiling per agent
    int maxDepth,       // function call nesting ceiling
    int maxMemory,      // reserved, not enforced
    OnLimit onLimit
) {

    public static final int DEFAULT_MAX_STEP = 1_000_000;
    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_MEMORY = 1_000_000;

    public static final int MAX_STEP_CEILING = 10_000_000;
    public static final int MAX_DEPTH_CEILING = 10_000;
    public static final int MAX_MEMORY_CEILING = 10_000_000;

    /**
     * Built-in defaults, used when no configuration is supplied.
     */
    public static LimitConfig defaults() {
        return new LimitConfig(DEFAULT_MAX_STEP, DEFAULT_MAX_DEPTH, DEFAULT_MAX_MEMORY, OnLimit.TRUNCATE);
    }

    public LimitConfig withMaxStep(int value) {
        return new LimitConfig(value, maxDepth, maxMemory, onLimit);
    }

    public LimitConfig withMaxDepth(int value) {
        return new LimitConfig(maxStep, value, maxMemory, onLimit);
    }

    public LimitConfig withMaxMemory(int value) {
        return new LimitConfig(maxStep, maxDepth, value, onLimit);
    }

    public LimitConfig withOnLimit(OnLimit value) {
        return new LimitConfig(maxStep, maxDepth, maxMemory, value);
    }

    @Override
    public String toString() {
        return String.format("MAX_STEP=%,d MAX_DEPTH=%,d MAX_MEMORY=%,d ON_LIMIT=%s",
                maxStep, maxDepth, maxMemory, onLimit);
    }
}
