package io.github.manjago.h2lang.core;

import java.util.List;

/**
 * Outcome of {@link H2Compiler#compile(String)} or {@link H2Compiler#validate(String)}.
 */
public sealed interface CompileResult {

    boolean isSuccess();

    /**
     * Compiled program. After validation only, agents and timeline are empty.
     */
    record Success(List<CompiledAgent> agents, List<TimelineStep> timeline, int maxSteps)
            implements CompileResult {

        public Success {
            agents = List.copyOf(agents);
            timeline = List.copyOf(timeline);
        }

        static Success validated() {
            return new Success(List.of(), List.of(), 0);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Compilation stopped at the first error.
     */
    record Failure(List<CompileError> errors) implements CompileResult {

        public Failure {
            errors = List.copyOf(errors);
        }

        static Failure of(H2Exception e) {
            return new Failure(List.of(CompileError.from(e)));
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
