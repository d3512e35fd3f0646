package io.github.jbellis.codegrapher.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A type declaration in the graph: class, struct, enum, protocol or extension.
 * <p>
 * {@code inheritedTypes} and {@code conformedProtocols} are split by position in the inheritance clause
 * (first entry vs. the rest), not by what the names actually refer to. A protocol-only conformance list
 * therefore reports its first protocol as an inherited type. Extensions report their whole clause as
 * conformed protocols.
 */
@JsonPropertyOrder({"name", "kind", "inheritedTypes", "conformedProtocols", "properties", "methods"})
public record CodeEntity(String name,
                         EntityKind kind,
                         List<String> inheritedTypes,
                         List<String> conformedProtocols,
                         List<PropertyInfo> properties,
                         List<MethodInfo> methods) {

    public static final String EXTENSION_PREFIX = "Extension_of_";

    public CodeEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        inheritedTypes = List.copyOf(inheritedTypes);
        conformedProtocols = List.copyOf(conformedProtocols);
        properties = List.copyOf(properties);
        methods = List.copyOf(methods);
    }

    /** Graph key used for an extension of {@code extendedType}. */
    public static String extensionName(String extendedType) {
        return EXTENSION_PREFIX + extendedType;
    }
}
