package io.github.jbellis.codegrapher.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A stored or computed property (var/let) declared in an entity body.
 */
@JsonPropertyOrder({"name", "type"})
public record PropertyInfo(String name, String type) {
    /** Recorded when the binding carries no explicit type annotation. */
    public static final String UNKNOWN_TYPE = "Unknown";

    public PropertyInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
