package org.postfixer.compiler.frontend.parser;

import org.postfixer.compiler.api.CompilationException;
import org.postfixer.compiler.api.CompilerErrorCode;
import org.postfixer.compiler.api.SourceInfo;
import org.postfixer.compiler.frontend.lexer.Token;
import org.postfixer.compiler.frontend.lexer.TokenType;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.compiler.frontend.parser.ast.AtomNode;
import org.postfixer.compiler.frontend.parser.ast.Fixity;
import org.postfixer.compiler.frontend.parser.ast.OperatorNode;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Operator-precedence (Pratt) parser. It consumes the tokens of one line through a
 * {@link TokenCursor} and builds an expression tree in a single recursive function,
 * {@link #parseExpression(int)}, driven by the {@link BindingPowers} table.
 * <p>
 * Prefix, infix, postfix and ternary operators are handled uniformly. Groups and the
 * ternary separator are the only constructs with dedicated code. A parser instance is
 * good for one parse.
 */
public class Parser {

    /** Opens a parenthesized group. */
    public static final String GROUP_OPEN = "(";
    /** Closes a parenthesized group. */
    public static final String GROUP_CLOSE = ")";
    /** Default bound on recursive descent. */
    public static final int DEFAULT_MAX_DEPTH = 256;

    private final TokenCursor cursor;
    private final BindingPowers powers;
    private final GroupingMode groupingMode;
    private final int maxDepth;
    private int depth = 0;

    /**
     * Constructs a parser using the standard operator table and explicit grouping.
     * @param tokens The tokens of one line, ending with an end-marker.
     */
    public Parser(List<Token> tokens) {
        this(tokens, BindingPowers.standard(), GroupingMode.EXPLICIT, DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The tokens of one line, ending with an end-marker.
     * @param powers The operator table.
     * @param groupingMode How parenthesized groups are closed.
     * @param maxDepth The deepest allowed nesting of sub-expressions.
     */
    public Parser(List<Token> tokens, BindingPowers powers, GroupingMode groupingMode, int maxDepth) {
        this.cursor = new TokenCursor(tokens);
        this.powers = powers;
        this.groupingMode = groupingMode;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses the whole token sequence as one expression.
     * @return The root of the expression tree.
     * @throws CompilationException with {@link CompilerErrorCode#UNEXPECTED_TOKEN} if a token cannot
     *         start or continue the expression, or input remains after it; with
     *         {@link CompilerErrorCode#UNBOUND_OPERATOR} if an operator has no power for its role.
     */
    public AstNode parse() throws CompilationException {
        AstNode root = parseExpression(0);
        if (!cursor.isAtEnd()) {
            Token leftover = cursor.peek();
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Unexpected " + leftover.describe() + " after complete expression", leftover);
        }
        return root;
    }

    /**
     * Parses an expression whose operators all bind at least as tightly as {@code minBindingPower}.
     * Stops before the first operator that binds more loosely, leaving it for the caller.
     *
     * @param minBindingPower The minimum left binding power an operator needs to extend the expression.
     * @return The parsed sub-tree.
     * @throws CompilationException if the tokens do not form an expression.
     */
    public AstNode parseExpression(int minBindingPower) throws CompilationException {
        if (++depth > maxDepth) {
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expression nesting too deep (limit " + maxDepth + ")", cursor.peek());
        }
        try {
            AstNode lhs = parseOperand();

            while (true) {
                Token lookahead = cursor.peek();
                if (lookahead.type() == TokenType.END) {
                    break;
                }
                if (lookahead.type() == TokenType.LEAF) {
                    throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                            "Unexpected " + lookahead.describe() + ", expected an operator", lookahead);
                }

                String symbol = lookahead.text();
                if (isClosingDelimiter(symbol)) {
                    break;
                }

                OptionalInt postfixPower = powers.postfix(symbol);
                if (postfixPower.isPresent() && postfixPower.getAsInt() >= minBindingPower) {
                    cursor.next();
                    lhs = new OperatorNode(lookahead, Fixity.POSTFIX, List.of(lhs));
                    continue;
                }

                Optional<BindingPowers.InfixPower> infixPower = powers.infix(symbol);
                if (infixPower.isEmpty()) {
                    if (powers.knows(symbol)) {
                        // Binds in another role; an enclosing call decides what to do with it.
                        break;
                    }
                    throw error(CompilerErrorCode.UNBOUND_OPERATOR,
                            "Operator " + lookahead.describe() + " has no infix or postfix binding power", lookahead);
                }
                if (infixPower.get().left() < minBindingPower) {
                    break;
                }

                cursor.next();
                Optional<String> separator = powers.ternarySeparator(symbol);
                if (separator.isPresent()) {
                    AstNode middle = parseExpression(0);
                    expect(separator.get());
                    AstNode rhs = parseExpression(infixPower.get().right());
                    lhs = new OperatorNode(lookahead, Fixity.TERNARY, List.of(lhs, middle, rhs));
                } else {
                    AstNode rhs = parseExpression(infixPower.get().right());
                    lhs = new OperatorNode(lookahead, Fixity.INFIX, List.of(lhs, rhs));
                }
            }
            return lhs;
        } finally {
            depth--;
        }
    }

    private AstNode parseOperand() throws CompilationException {
        Token token = cursor.next();
        switch (token.type()) {
            case LEAF:
                return new AtomNode(token);
            case OPERATOR:
                if (token.text().equals(GROUP_OPEN)) {
                    AstNode inner = parseExpression(0);
                    if (groupingMode == GroupingMode.EXPLICIT) {
                        expect(GROUP_CLOSE);
                    }
                    return inner;
                }
                OptionalInt prefixPower = powers.prefix(token.text());
                if (prefixPower.isEmpty()) {
                    throw error(CompilerErrorCode.UNBOUND_OPERATOR,
                            "Operator " + token.describe() + " cannot start an expression", token);
                }
                AstNode operand = parseExpression(prefixPower.getAsInt());
                return new OperatorNode(token, Fixity.PREFIX, List.of(operand));
            default:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected " + token.describe() + ", expected an operand", token);
        }
    }

    private boolean isClosingDelimiter(String symbol) {
        if (groupingMode == GroupingMode.EXPLICIT && symbol.equals(GROUP_CLOSE)) {
            return true;
        }
        return powers.isTernarySeparator(symbol);
    }

    private void expect(String symbol) throws CompilationException {
        Token token = cursor.next();
        if (!token.isOperator(symbol)) {
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected '" + symbol + "' but found " + token.describe(), token);
        }
    }

    private CompilationException error(CompilerErrorCode code, String message, Token token) {
        return new CompilationException(code, message, new SourceInfo(token.column()));
    }
}
