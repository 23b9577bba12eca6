package org.postfixer.compiler.backend.emit;

import org.postfixer.compiler.frontend.TreeWalker;
import org.postfixer.compiler.frontend.parser.ast.AstNode;
import org.postfixer.compiler.frontend.parser.ast.AtomNode;
import org.postfixer.compiler.frontend.parser.ast.OperatorNode;

import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * Renders an expression tree in reverse-Polish notation: every child, left to right,
 * followed by the node's own symbol, separated by single spaces.
 * <pre>
 *   (3 + 4) * 5   ->   3 4 + 5 *
 * </pre>
 */
public final class PostfixPrinter {

    private PostfixPrinter() {}

    /**
     * @param root The root of the tree.
     * @return The postfix rendering.
     */
    public static String print(AstNode root) {
        StringJoiner out = new StringJoiner(" ");
        Consumer<AstNode> append = node -> out.add(node.symbol());
        new TreeWalker(Map.of(
                AtomNode.class, append,
                OperatorNode.class, append
        )).walk(root);
        return out.toString();
    }
}
