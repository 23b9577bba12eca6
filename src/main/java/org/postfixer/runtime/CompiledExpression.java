package org.postfixer.runtime;

import org.postfixer.compiler.api.BackendException;

/**
 * A zero-argument callable produced by an execution backend. Each call evaluates the
 * program it was compiled from and returns the single value left on the stack.
 */
@FunctionalInterface
public interface CompiledExpression {

    /**
     * @return The value of the expression.
     * @throws BackendException if evaluation fails, e.g. on division by zero.
     */
    int evaluate() throws BackendException;
}
