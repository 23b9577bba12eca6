package org.postfixer.compiler.frontend.lexer;

import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompilerErrorCode;
import org.postfixer.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Splits one line of text into tokens, terminated by an end-marker:
 * <ul>
 *     <li>consecutive digits merge into one {@link TokenType#LEAF} token,</li>
 *     <li>any other letter becomes a single-character leaf,</li>
 *     <li>whitespace is skipped,</li>
 *     <li>every other character becomes a single-character {@link TokenType#OPERATOR}.</li>
 * </ul>
 * In strict mode an operator character must be accepted by the supplied alphabet, otherwise
 * tokenization fails with {@link CompilerErrorCode#ILLEGAL_CHARACTER}.
 */
public class Lexer {

    private final String line;
    private final Predicate<String> operatorAlphabet;
    private int pos = 0;

    /**
     * Creates a lenient Lexer that accepts every non-whitespace character.
     * @param line The input line.
     */
    public Lexer(String line) {
        this(line, null);
    }

    /**
     * @param line The input line.
     * @param operatorAlphabet Decides which operator characters are legal, or null to accept all of them.
     */
    public Lexer(String line, Predicate<String> operatorAlphabet) {
        this.line = line;
        this.operatorAlphabet = operatorAlphabet;
    }

    /**
     * Tokenizes the entire line.
     * @return An unmodifiable list of the recognized tokens, always ending with an end-marker.
     * @throws CompilationException in strict mode, if an operator character is not in the alphabet.
     */
    public List<Token> scanTokens() throws CompilationException {
        List<Token> tokens = new ArrayList<>();
        for (Token token = nextToken(); token.type() != TokenType.END; token = nextToken()) {
            tokens.add(token);
        }
        tokens.add(Token.end(line.length() + 1));
        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken() throws CompilationException {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        if (pos >= line.length()) {
            return Token.end(line.length() + 1);
        }

        int begin = pos;
        char first = line.charAt(pos++);
        if (isAsciiDigit(first)) {
            while (pos < line.length() && isAsciiDigit(line.charAt(pos))) {
                pos++;
            }
            return slice(TokenType.LEAF, begin);
        }
        if (isAsciiLetter(first)) {
            return slice(TokenType.LEAF, begin);
        }

        Token operator = slice(TokenType.OPERATOR, begin);
        if (operatorAlphabet != null && !operatorAlphabet.test(operator.text())) {
            throw new CompilationException(CompilerErrorCode.ILLEGAL_CHARACTER,
                    "Illegal character '" + operator.text() + "'", new SourceInfo(operator.column()));
        }
        return operator;
    }

    private Token slice(TokenType type, int begin) {
        return new Token(type, line.substring(begin, pos), begin + 1);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
