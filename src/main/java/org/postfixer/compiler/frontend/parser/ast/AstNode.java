package org.postfixer.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the expression tree.
 * Nodes are immutable and every child is owned by exactly one parent.
 */
public interface AstNode {

    /**
     * @return The text this node contributes to the postfix form: the literal for an atom,
     *         the operator symbol for an operator node.
     */
    String symbol();

    /**
     * @return The 1-based input column of the token this node was built from.
     */
    int column();

    /**
     * Returns a list of the direct child nodes, in left-to-right source order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
