package org.postfixer.compiler;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompiledProgram;
import org.postfixer.compiler.api.ICompiler;
import org.postfixer.compiler.backend.emit.InstructionEmitter;
import org.postfixer.compiler.backend.emit.PostfixPrinter;
import org.postfixer.compiler.frontend.lexer.Lexer;
import org.postfixer.compiler.frontend.lexer.Token;
import org.postfixer.compiler.frontend.parser.BindingPowers;
import org.postfixer.compiler.frontend.parser.Parser;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.runtime.BackendFactory;
import org.postfixer.runtime.CompiledExpression;
import org.postfixer.runtime.IBackendSession;
import org.postfixer.runtime.IExecutionBackend;
import org.postfixer.runtime.RuntimeOptions;
import org.postfixer.runtime.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * The main compiler implementation. It orchestrates the pipeline
 * text → tokens → expression tree → postfix text and instructions, and hands the
 * instructions to an {@link IExecutionBackend} for evaluation.
 * <p>
 * The compiler itself holds no per-expression state; each call creates its own lexer,
 * parser and backend session.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;
    private final BindingPowers powers;
    private final IExecutionBackend backend;

    /**
     * Creates a compiler with default options and the interpreting backend.
     */
    public Compiler() {
        this(CompilerOptions.defaults(), BackendFactory.create(RuntimeOptions.defaults()));
    }

    /**
     * @param options Lexer and parser settings.
     * @param backend The backend that executes compiled programs.
     */
    public Compiler(CompilerOptions options, IExecutionBackend backend) {
        this(options, BindingPowers.standard(), backend);
    }

    /**
     * @param options Lexer and parser settings.
     * @param powers The operator table.
     * @param backend The backend that executes compiled programs.
     */
    public Compiler(CompilerOptions options, BindingPowers powers, IExecutionBackend backend) {
        this.options = options;
        this.powers = powers;
        this.backend = backend;
    }

    /**
     * Parses one line into an expression tree without linearizing it.
     * @param line The expression text.
     * @return The root of the tree.
     * @throws CompilationException if the line cannot be tokenized or parsed.
     */
    public AstNode parse(String line) throws CompilationException {
        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(line, operatorAlphabet()).scanTokens();
        LOG.debug("Lexed {} tokens from '{}'", tokens.size() - 1, line);

        // Phase 2: Parsing (builds the tree)
        Parser parser = new Parser(tokens, powers, options.groupingMode(), options.maxDepth());
        return parser.parse();
    }

    @Override
    public CompiledProgram compile(String line) throws CompilationException {
        AstNode ast = parse(line);

        // Phase 3: Linearization
        String postfix = PostfixPrinter.print(ast);
        List<Instruction> instructions = new InstructionEmitter().emit(ast);
        LOG.debug("Compiled '{}' to '{}' ({} instructions)", line, postfix, instructions.size());
        return new CompiledProgram(line, ast, postfix, instructions);
    }

    @Override
    public int evaluate(String line) throws CompilationException {
        return execute(compile(line).instructions());
    }

    /**
     * Runs an already linearized program on the backend.
     * @param instructions The program.
     * @return The integer result.
     * @throws BackendException if the backend rejects the program or evaluation fails.
     */
    public int execute(List<Instruction> instructions) throws BackendException {
        // Phase 4: Backend compilation, scoped to this program
        CompiledExpression callable;
        try (IBackendSession session = backend.openSession()) {
            callable = session.compile(instructions);
        }
        int result = callable.evaluate();
        LOG.debug("{} evaluated {} instructions to {}", backend.getName(), instructions.size(), result);
        return result;
    }

    public IExecutionBackend getBackend() {
        return backend;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    private Predicate<String> operatorAlphabet() {
        if (!options.strictLexing()) {
            return null;
        }
        return symbol -> powers.knows(symbol) || symbol.equals(Parser.GROUP_OPEN) || symbol.equals(Parser.GROUP_CLOSE);
    }
}
