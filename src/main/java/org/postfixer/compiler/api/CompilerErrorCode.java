package org.postfixer.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while turning
 * an expression into an executable program.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Lexer & Parser Errors
    /** A token appeared where it cannot start or continue an expression (including a premature end of input). */
    UNEXPECTED_TOKEN,
    /** An operator has no binding power for the role it was used in (prefix, infix or postfix). */
    UNBOUND_OPERATOR,
    /** A character outside the accepted alphabet was found while tokenizing in strict mode. */
    ILLEGAL_CHARACTER,
    // endregion

    // region Backend Errors
    /** The execution backend rejected the instruction sequence or failed while evaluating it. */
    BACKEND_FAILURE
    // endregion
}
