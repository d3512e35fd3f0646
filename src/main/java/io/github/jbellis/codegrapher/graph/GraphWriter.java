package io.github.jbellis.codegrapher.graph;

import io.github.jbellis.codegrapher.util.AtomicWrites;
import io.github.jbellis.codegrapher.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Encodes a {@link CodeGraph} as one JSON object keyed by entity name, keys in sorted order.
 * <p>
 * Consumers should treat {@code inheritedTypes} / {@code conformedProtocols} as approximate: the split is
 * positional (first entry of the inheritance clause vs. the rest), so a type that only conforms to protocols
 * reports its first protocol under {@code inheritedTypes}. Extensions list their whole clause under
 * {@code conformedProtocols}.
 */
public final class GraphWriter {
    private static final Logger logger = LogManager.getLogger(GraphWriter.class);

    public static final String DEFAULT_FILE_NAME = "codegraph.json";

    public String toJson(CodeGraph graph) throws IOException {
        return Json.toJson(graph.entities());
    }

    /**
     * Writes the graph to {@code target}, replacing any previous file.
     *
     * @throws IOException if encoding or writing fails
     */
    public void write(CodeGraph graph, Path target) throws IOException {
        var json = toJson(graph);
        AtomicWrites.atomicOverwrite(target, json);
        logger.info("Wrote {} entities to {}", graph.size(), target);
    }
}
