package io.github.jbellis.codegrapher.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * A parsed source file: the tree-sitter tree plus the source it was parsed from.
 * Tree-sitter reports node offsets in UTF-8 bytes, so text is sliced from the encoded source rather than
 * from the Java string.
 */
public final class SyntaxTree {
    private final ProjectFile file;
    private final TSTree tree; // keeps the native tree alive as long as nodes are in use
    private final byte[] utf8;

    SyntaxTree(ProjectFile file, String source, TSTree tree) {
        this.file = file;
        this.tree = tree;
        this.utf8 = source.getBytes(StandardCharsets.UTF_8);
    }

    public ProjectFile file() {
        return file;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    /** True if tree-sitter had to recover from syntax errors somewhere in the file. */
    public boolean hasErrors() {
        return root().hasError();
    }

    /** Source text covered by {@code node}, untrimmed; empty for a null node. */
    public String text(TSNode node) {
        if (node == null || node.isNull()) return "";
        return text(node.getStartByte(), node.getEndByte());
    }

    /** Source text between two byte offsets. */
    public String text(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, utf8.length));
        int end = Math.max(start, Math.min(endByte, utf8.length));
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }
}
