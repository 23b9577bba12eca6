package org.postfixer.compiler.frontend;

import org.postfixer.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Depth-first, children-first traversal of an expression tree. Visiting the operands before
 * their operator is exactly the reverse-Polish order, so both linearizers are a pair of
 * handlers on top of this walk.
 * <p>
 * Handlers are looked up by the node's concrete class; a class without a handler is passed
 * over but its children are still visited.
 * <p>
 * The walk keeps its own stack, so left-deep chains of any length do not exhaust the thread stack.
 */
public class TreeWalker {

    private static final Consumer<AstNode> IGNORE = node -> { };

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * @param handlers One handler per node class.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Visits every node below {@code root}, then {@code root} itself. A null root is a no-op.
     * @param root The subtree to walk.
     */
    public void walk(AstNode root) {
        if (root == null) {
            return;
        }
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root));
        while (!pending.isEmpty()) {
            Frame top = pending.peek();
            if (top.children().hasNext()) {
                pending.push(new Frame(top.children().next()));
            } else {
                pending.pop();
                handlers.getOrDefault(top.node().getClass(), IGNORE).accept(top.node());
            }
        }
    }

    private record Frame(AstNode node, Iterator<AstNode> children) {
        Frame(AstNode node) {
            this(node, node.getChildren().iterator());
        }
    }
}
