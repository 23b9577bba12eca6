package org.postfixer.runtime;

import org.postfixer.compiler.api.BackendException;
import org.postfixer.runtime.isa.Instruction;

import java.util.List;

/**
 * A scoped compilation context acquired from an {@link IExecutionBackend}. Open one per
 * expression in a try-with-resources block; a closed session rejects further compilation.
 * Sessions are not thread-safe. Callables compiled by a session remain usable after it is closed.
 */
public interface IBackendSession extends AutoCloseable {

    /**
     * Turns a postfix instruction sequence into a callable.
     * @param program The instructions, in execution order.
     * @return The callable.
     * @throws BackendException if the program contains an instruction the machine does not support
     *                          or does not leave exactly one value on the stack.
     * @throws IllegalStateException if the session is closed.
     */
    CompiledExpression compile(List<Instruction> program) throws BackendException;

    /**
     * Releases the session. Idempotent.
     */
    @Override
    void close();
}
