package org.postfixer.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** An operand: a run of decimal digits or a single letter. */
    LEAF,
    /** Any other single non-whitespace character. */
    OPERATOR,
    /** Marks the end of the token sequence. */
    END
}
