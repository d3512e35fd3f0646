package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.CodeEntity;

import java.util.List;

/**
 * Entities extracted from one file, in the order their declarations were entered.
 *
 * @param hasSyntaxErrors true if the parser recovered from errors; the entities are still usable
 */
public record FileExtraction(ProjectFile file, List<CodeEntity> entities, boolean hasSyntaxErrors) {
    public FileExtraction {
        entities = List.copyOf(entities);
    }
}
