package io.github.jbellis.codegrapher.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterSwift;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Turns Swift source text into a tree-sitter {@link SyntaxTree}.
 * Safe to share between threads: TSParser is not threadsafe, so each thread gets its own parser and grammar.
 */
public final class SwiftParser {
    private static final Logger logger = LogManager.getLogger(SwiftParser.class);

    private final ThreadLocal<TSParser> parser;

    public SwiftParser() {
        this(TreeSitterSwift::new);
    }

    SwiftParser(Supplier<TSLanguage> languageFactory) {
        this.parser = ThreadLocal.withInitial(() -> {
            var localParser = new TSParser();
            if (!localParser.setLanguage(languageFactory.get())) {
                throw new IllegalStateException("Failed to set Swift language on TSParser");
            }
            return localParser;
        });
    }

    /**
     * Reads and parses {@code file}.
     *
     * @throws IOException          if the file cannot be read as UTF-8
     * @throws SourceParseException if tree-sitter returns no tree
     */
    public SyntaxTree parse(ProjectFile file) throws IOException {
        logger.debug("Parsing {}", file);
        return parse(file, file.read());
    }

    /** Parses {@code source} as the contents of {@code file}. */
    public SyntaxTree parse(ProjectFile file, String source) {
        TSTree tree = parser.get().parseString(null, source);
        if (tree == null) {
            throw new SourceParseException(file, "parser returned no tree");
        }
        var rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new SourceParseException(file, "parser returned a null root node");
        }
        var syntaxTree = new SyntaxTree(file, source, tree);
        if (syntaxTree.hasErrors()) {
            logger.warn("Syntax errors in {}; extracting from the recovered tree", file);
        }
        return syntaxTree;
    }
}
