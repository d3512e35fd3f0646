package io.github.jbellis.codegrapher.graph;

import io.github.jbellis.codegrapher.analyzer.FileExtraction;
import io.github.jbellis.codegrapher.model.CodeEntity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The graph accumulated over one run: entity name to entity, across every processed file.
 * Entities are never removed. Not threadsafe; a single thread performs all registrations.
 */
public final class CodeGraph {
    private static final Logger logger = LogManager.getLogger(CodeGraph.class);

    private final Map<String, CodeEntity> entities = new HashMap<>();
    private final DuplicatePolicy duplicatePolicy;

    public CodeGraph(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    public CodeGraph() {
        this(DuplicatePolicy.OVERWRITE);
    }

    public DuplicatePolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    /** Registers {@code entity} under its name, resolving a clash with the duplicate policy. */
    public void register(CodeEntity entity) {
        entities.merge(entity.name(), entity, (existing, incoming) -> {
            logger.debug("Entity {} registered again; applying {}", incoming.name(), duplicatePolicy);
            return duplicatePolicy.resolve(existing, incoming);
        });
    }

    /** Registers a file's entities in the order they were declared. */
    public void registerAll(FileExtraction extraction) {
        extraction.entities().forEach(this::register);
    }

    public Optional<CodeEntity> get(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /** Snapshot ordered by entity name, so output does not depend on registration order. */
    public SortedMap<String, CodeEntity> entities() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(entities));
    }
}
