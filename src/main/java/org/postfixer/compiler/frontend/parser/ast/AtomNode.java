package org.postfixer.compiler.frontend.parser.ast;

import org.postfixer.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a leaf operand: a numeric literal or a single-letter name.
 *
 * @param token The leaf token.
 */
public record AtomNode(
        Token token
) implements AstNode {

    @Override
    public String symbol() {
        return token.text();
    }

    @Override
    public int column() {
        return token.column();
    }

    /**
     * @return {@code true} if the atom is a run of decimal digits.
     */
    public boolean isNumeric() {
        String text = token.text();
        if (text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    // This node has no children and inherits the empty list from getChildren().
}
