package io.github.jbellis.codegrapher.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers over {@link TSNode}, which reports absent nodes either as Java null or as a "null node".
 */
final class SyntaxNodes {
    private SyntaxNodes() {
    }

    static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** All direct children, named and anonymous, in source order. */
    static List<TSNode> children(TSNode node) {
        int count = node.getChildCount();
        var result = new ArrayList<TSNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** The child stored under {@code fieldName}, or null if the grammar did not produce one. */
    static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** The parent, or null at the root. */
    static @Nullable TSNode parent(TSNode node) {
        var parent = node.getParent();
        return isPresent(parent) ? parent : null;
    }

    /** Identity by position and type; stable across the distinct wrapper objects tree-sitter hands out. */
    static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
               && a.getEndByte() == b.getEndByte()
               && a.getType().equals(b.getType());
    }
}
