package io.github.jbellis.codegrapher.testutil;

import io.github.jbellis.codegrapher.analyzer.DeclarationWalker;
import io.github.jbellis.codegrapher.analyzer.FileExtraction;
import io.github.jbellis.codegrapher.analyzer.ProjectFile;
import io.github.jbellis.codegrapher.analyzer.SwiftParser;
import io.github.jbellis.codegrapher.analyzer.SyntaxTree;
import io.github.jbellis.codegrapher.model.CodeEntity;
import io.github.jbellis.codegrapher.model.MethodInfo;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Parses inline Swift snippets for extractor tests.
 */
public final class SwiftSnippets {
    private static final SwiftParser PARSER = new SwiftParser();
    private static final DeclarationWalker WALKER = new DeclarationWalker();
    private static final Path ROOT = Path.of(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize();

    private SwiftSnippets() {
    }

    public static SyntaxTree parse(String code) {
        return PARSER.parse(new ProjectFile(ROOT, "Snippet.swift"), code);
    }

    public static FileExtraction extract(String code) {
        return WALKER.walk(parse(code));
    }

    /** The single entity named {@code name}; fails if absent or declared more than once. */
    public static CodeEntity entity(FileExtraction extraction, String name) {
        var matches = extraction.entities().stream().filter(e -> e.name().equals(name)).toList();
        assertEquals(1, matches.size(), () -> "Expected exactly one entity " + name + " in " + extraction.entities());
        return matches.get(0);
    }

    public static MethodInfo method(CodeEntity entity, String name) {
        return entity.methods().stream()
                .filter(m -> m.name().equals(name))
                .findFirst()
                .orElseGet(() -> fail("No method " + name + " in " + entity));
    }

    public static void assertNoEntity(FileExtraction extraction, String name) {
        assertTrue(extraction.entities().stream().noneMatch(e -> e.name().equals(name)),
                   () -> "Unexpected entity " + name + " in " + extraction.entities());
    }
}
