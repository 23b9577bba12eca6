package org.postfixer.compiler.frontend.parser.ast;

/**
 * The syntactic role an operator played when its node was built. It fixes the number of operands.
 */
public enum Fixity {
    PREFIX(1),
    POSTFIX(1),
    INFIX(2),
    TERNARY(3);

    private final int arity;

    Fixity(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }
}
