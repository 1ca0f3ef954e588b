package org.loxfront.compiler.frontend;

import org.loxfront.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between consumers and the AST structure.
 * <p>
 * Traversal is pre-order and uses an explicit stack, so deeply nested trees
 * do not grow the Java call stack.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes in order.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and all of its descendants.
     * @param root The node to walk.
     */
    public void walk(AstNode root) {
        if (root == null) {
            return;
        }
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

            // Push in reverse so children are visited in source order.
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Counts the nodes of a tree, including the root.
     * @param root The root node.
     * @return The number of nodes.
     */
    public static int countNodes(AstNode root) {
        int count = 0;
        Deque<AstNode> stack = new ArrayDeque<>();
        if (root != null) stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            count++;
            node.getChildren().forEach(stack::push);
        }
        return count;
    }
}
