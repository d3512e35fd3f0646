package io.github.jbellis.codegrapher.graph;

import io.github.jbellis.codegrapher.model.CodeEntity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * What the graph does when an entity is registered under a name it already holds, e.g. two extensions of
 * the same type or the same class declared in two files.
 */
public enum DuplicatePolicy {
    /** The later entity replaces the earlier one; nothing of the earlier one survives. */
    OVERWRITE {
        @Override
        CodeEntity resolve(CodeEntity existing, CodeEntity incoming) {
            return incoming;
        }
    },
    /**
     * Properties and methods are concatenated, inheritance lists are unioned keeping first-seen order,
     * and the later entity's kind wins.
     */
    MERGE {
        @Override
        CodeEntity resolve(CodeEntity existing, CodeEntity incoming) {
            var properties = new ArrayList<>(existing.properties());
            properties.addAll(incoming.properties());
            var methods = new ArrayList<>(existing.methods());
            methods.addAll(incoming.methods());
            return new CodeEntity(incoming.name(),
                                  incoming.kind(),
                                  union(existing.inheritedTypes(), incoming.inheritedTypes()),
                                  union(existing.conformedProtocols(), incoming.conformedProtocols()),
                                  properties,
                                  methods);
        }
    };

    abstract CodeEntity resolve(CodeEntity existing, CodeEntity incoming);

    private static List<String> union(List<String> first, List<String> second) {
        var merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return List.copyOf(merged);
    }

    /** Parses {@code overwrite} / {@code merge}, case-insensitively. */
    public static DuplicatePolicy fromString(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "overwrite" -> OVERWRITE;
            case "merge" -> MERGE;
            default -> throw new IllegalArgumentException(
                    "Unknown duplicate policy '" + value + "', expected overwrite or merge");
        };
    }
}
