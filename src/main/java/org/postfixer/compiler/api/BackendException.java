package org.postfixer.compiler.api;

/**
 * Raised when an execution backend rejects an instruction sequence (unknown instruction,
 * stack underflow or overflow) or fails while evaluating it (division by zero).
 */
public class BackendException extends CompilationException {

    public BackendException(String message) {
        super(CompilerErrorCode.BACKEND_FAILURE, message);
    }

    public BackendException(String message, Throwable cause) {
        super(CompilerErrorCode.BACKEND_FAILURE, message, cause);
    }
}
