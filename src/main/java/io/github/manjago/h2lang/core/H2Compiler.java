package io.github.manjago.h2lang.core;

import io.github.manjago.h2lang.ast.Agent;
import io.github.manjago.h2lang.ast.Program;
import io.github.manjago.h2lang.config.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for hosts: source text in, commands and timeline out.
 * <p>
 * Errors never escape as exceptions. The first lexer, parser or expansion
 * error is returned as a {@link CompileResult.Failure} and later agents are
 * not expanded.
 */
public class H2Compiler {

    private static final Logger log = LoggerFactory.getLogger(H2Compiler.class);

    public static final String VERSION = "1.0.0";

    private final CompilerConfig config;
    private final ExpansionListener listener;

    public H2Compiler() {
        this(CompilerConfig.builder().build());
    }

    public H2Compiler(CompilerConfig config) {
        this(config, ExpansionListener.NOOP);
    }

    public H2Compiler(CompilerConfig config, ExpansionListener listener) {
        this.config = config;
        this.listener = listener;
    }

    /**
     * Lex, parse, expand every agent and schedule the result.
     */
    public CompileResult compile(String source) {
        Program program;
        try {
            program = parse(source);
        } catch (H2Exception e) {
            log.debug("Compilation failed: {}", e.toString());
            return CompileResult.Failure.of(e);
        }

        Expander expander = new Expander(program.limits(), listener);
        List<AgentCommands> expanded = new ArrayList<>();
        List<CompiledAgent> agents = new ArrayList<>();

        for (Agent agent : program.agents()) {
            try {
                List<Command> commands = expander.expandAgent(agent);
                expanded.add(new AgentCommands(agent.id(), commands));
                agents.add(new CompiledAgent(agent.id(), commands));
            } catch (Expander.ExpandException e) {
                log.debug("Agent {} failed: {}", agent.id(), e.toString());
                return CompileResult.Failure.of(e);
            }
        }

        List<TimelineStep> timeline = Scheduler.schedule(expanded);
        return new CompileResult.Success(agents, timeline, timeline.size());
    }

    /**
     * Lex and parse only.
     */
    public CompileResult validate(String source) {
        try {
            parse(source);
            return CompileResult.Success.validated();
        } catch (H2Exception e) {
            return CompileResult.Failure.of(e);
        }
    }

    /**
     * Parse with this compiler's configured limits as defaults.
     *
     * @throws Lexer.LexerException  on a lexical error
     * @throws Parser.ParseException on a syntax, directive or type-conflict error
     */
    public Program parse(String source) throws Lexer.LexerException, Parser.ParseException {
        return new Parser(source, config.limits()).parseProgram();
    }

    /**
     * Golf byte count, see {@link GolfByteCounter}.
     */
    public int countBytes(String source) throws Lexer.LexerException, Parser.ParseException {
        return GolfByteCounter.count(source);
    }

    public String version() {
        return VERSION;
    }
}
