package org.learningjava.settingscan.domain.service.query;

import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parent links and document order of one tree, computed once per query evaluation.
 * The root has no parent: a query never leaves the tree it was run on.
 */
final class UastDocument {

    private final UastNode root;
    private final Map<UastNode, UastNode> parents = new IdentityHashMap<>();
    private final Map<UastNode, Integer> order = new IdentityHashMap<>();

    UastDocument(UastNode root) {
        this.root = root;
        Deque<UastNode> stack = new ArrayDeque<>();
        stack.push(root);
        int index = 0;
        while (!stack.isEmpty()) {
            UastNode node = stack.pop();
            order.put(node, index++);
            List<UastNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                UastNode child = children.get(i);
                parents.put(child, node);
                stack.push(child);
            }
        }
    }

    UastNode root() {
        return root;
    }

    UastNode parentOf(UastNode node) {
        return parents.get(node);
    }

    int orderOf(UastNode node) {
        Integer i = order.get(node);
        if (i == null) throw new IllegalStateException("Node is not part of this document: " + node);
        return i;
    }
}
