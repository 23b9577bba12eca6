package org.postfixer.compiler.frontend.parser;

import org.postfixer.compiler.frontend.lexer.Token;
import org.postfixer.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A forward-only, single-pass view over a token sequence. Once exhausted it keeps
 * answering with an end-marker. Not restartable and not thread-safe; it is owned by one parse.
 */
public class TokenCursor {

    private final List<Token> tokens;
    private final Token end;
    private int current = 0;

    /**
     * @param tokens The tokens to stream over, as produced by the lexer.
     */
    public TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        this.end = last != null && last.type() == TokenType.END ? last : Token.end(1);
    }

    /**
     * @return The next unconsumed token, without advancing.
     */
    public Token peek() {
        if (isAtEnd()) return end;
        return tokens.get(current);
    }

    /**
     * @return The next unconsumed token, advancing past it.
     */
    public Token next() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    /**
     * @return {@code true} once every token before the end-marker has been consumed.
     */
    public boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).type() == TokenType.END;
    }
}
