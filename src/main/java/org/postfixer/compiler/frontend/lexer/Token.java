package org.postfixer.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the input by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token: a digit run, a letter, or one operator character.
 *             Empty for the end-marker.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int column
) {

    /**
     * Creates an end-marker token positioned at the given column.
     * @param column The column just past the last character of the input.
     * @return The end-marker.
     */
    public static Token end(int column) {
        return new Token(TokenType.END, "", column);
    }

    /**
     * @return {@code true} if this is an operator token spelled exactly {@code symbol}.
     */
    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }

    /**
     * @return A human-readable description for error messages.
     */
    public String describe() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
