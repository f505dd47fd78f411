package io.github.manjago.h2lang.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.h2lang.ast.LimitConfig;
import io.github.manjago.h2lang.ast.OnLimit;

import java.nio.file.Path;

/**
 * Configuration for the H2 compiler.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf. Directives in a program
 * override the limits configured here.
 */
public record CompilerConfig(
    // Limits
    int maxStep,
    int maxDepth,
    int maxMemory,
    OnLimit onLimit,

    // Output
    boolean showTimeline,
    boolean compact
) {

    /**
     * Load default configuration.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static CompilerConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     *
     * @throws ConfigException.BadValue if a limit is out of range or on-limit is unknown
     */
    public static CompilerConfig fromConfig(Config config) {
        Config c = config.getConfig("h2");

        String onLimitName = c.getString("limits.on-limit");
        OnLimit onLimit = OnLimit.byName(onLimitName);
        if (onLimit == null) {
            throw new ConfigException.BadValue(c.origin(), "h2.limits.on-limit",
                    "expected error or truncate, got '" + onLimitName + "'");
        }

        return new CompilerConfig(
            ranged(c, "limits.max-step", LimitConfig.MAX_STEP_CEILING),
            ranged(c, "limits.max-depth", LimitConfig.MAX_DEPTH_CEILING),
            ranged(c, "limits.max-memory", LimitConfig.MAX_MEMORY_CEILING),
            onLimit,
            c.getBoolean("output.timeline"),
            c.getBoolean("output.compact")
        );
    }

    private static int ranged(Config c, String path, int ceiling) {
        int value = c.getInt(path);
        if (value < 1 || value > ceiling) {
            throw new ConfigException.BadValue(c.origin(), "h2." + path,
                    "expected 1.." + ceiling + ", got " + value);
        }
        return value;
    }

    /**
     * Limits programs start from before their directives are applied.
     */
    public LimitConfig limits() {
        return new LimitConfig(maxStep, maxDepth, maxMemory, onLimit);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxStep = LimitConfig.DEFAULT_MAX_STEP;
        private int maxDepth = LimitConfig.DEFAULT_MAX_DEPTH;
        private int maxMemory = LimitConfig.DEFAULT_MAX_MEMORY;
        private OnLimit onLimit = OnLimit.TRUNCATE;
        private boolean showTimeline = false;
        private boolean compact = false;

        public Builder maxStep(int max) { this.maxStep = max; return this; }
        public Builder maxDepth(int max) { this.maxDepth = max; return this; }
        public Builder maxMemory(int max) { this.maxMemory = max; return this; }
        public Builder onLimit(OnLimit policy) { this.onLimit = policy; return this; }
        public Builder showTimeline(boolean show) { this.showTimeline = show; return this; }
        public Builder compact(boolean compact) { this.compact = compact; return this; }

        public CompilerConfig build() {
            return new CompilerConfig(maxStep, maxDepth, maxMemory, onLimit, showTimeline, compact);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            CompilerConfig:
              limits.max-step:    %,d
              limits.max-depth:   %,d
              limits.max-memory:  %,d
              limits.on-limit:    %s
              output.timeline:    %s
              output.compact:     %s
            """,
            maxStep,
            maxDepth,
            maxMemory,
            onLimit.name().toLowerCase(),
            showTimeline,
            compact
        );
    }
}
