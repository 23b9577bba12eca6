package org.postfixer.compiler.frontend.parser.ast;

import org.postfixer.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that applies an operator to its operands.
 *
 * @param operator The operator token.
 * @param fixity The role the operator was parsed in.
 * @param operands The operands in source order; their count equals {@code fixity.arity()}.
 */
public record OperatorNode(
        Token operator,
        Fixity fixity,
        List<AstNode> operands
) implements AstNode {

    public OperatorNode {
        operands = List.copyOf(operands);
        if (operands.size() != fixity.arity()) {
            throw new IllegalArgumentException(fixity + " operator '" + operator.text()
                    + "' needs " + fixity.arity() + " operands, got " + operands.size());
        }
    }

    @Override
    public String symbol() {
        return operator.text();
    }

    @Override
    public int column() {
        return operator.column();
    }

    @Override
    public List<AstNode> getChildren() {
        return operands;
    }
}
