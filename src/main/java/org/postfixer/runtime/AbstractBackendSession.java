package org.postfixer.runtime;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base class for sessions: tracks the open/closed state and verifies every program
 * before handing it to the concrete backend.
 */
public abstract class AbstractBackendSession implements IBackendSession {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractBackendSession.class);

    private final String backendName;
    private final ProgramVerifier verifier;
    private boolean closed = false;

    protected AbstractBackendSession(String backendName, int maxStackDepth) {
        this.backendName = backendName;
        this.verifier = new ProgramVerifier(maxStackDepth);
    }

    @Override
    public final CompiledExpression compile(List<Instruction> program) throws BackendException {
        if (closed) {
            throw new IllegalStateException(backendName + " session is closed");
        }
        int stackDepth = verifier.verify(program);
        CompiledExpression compiled = doCompile(List.copyOf(program), stackDepth);
        LOG.debug("{} compiled {} instructions (stack depth {})", backendName, program.size(), stackDepth);
        return compiled;
    }

    /**
     * Compiles a verified program.
     * @param program The program; it passed {@link ProgramVerifier#verify(List)}.
     * @param stackDepth The deepest stack the program reaches.
     * @return The callable.
     * @throws BackendException if the backend cannot compile the program.
     */
    protected abstract CompiledExpression doCompile(List<Instruction> program, int stackDepth) throws BackendException;

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOG.trace("{} session closed", backendName);
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
