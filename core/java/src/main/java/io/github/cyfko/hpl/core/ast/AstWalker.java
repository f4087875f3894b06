package io.github.cyfko.hpl.core.ast;

import io.github.cyfko.hpl.core.api.AstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Iterative traversals of property trees.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstWalker {

    private AstWalker() {
    }

    /**
     * Lists a node and all its descendants, parents before children, children in grammar order.
     *
     * @param root the first node of the traversal
     * @return the nodes of the subtree
     */
    public static Stream<AstNode> preorder(AstNode root) {
        List<AstNode> visited = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            visited.add(node);
            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return visited.stream();
    }

    /**
     * Collects the nodes of a given kind, in preorder.
     */
    public static <T extends AstNode> List<T> collect(AstNode root, Class<T> kind) {
        return preorder(root).filter(kind::isInstance).map(kind::cast).toList();
    }
}
