package io.github.jbellis.codegrapher.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The syntactic category of a top-level type declaration.
 */
public enum EntityKind {
    CLASS("class"),
    STRUCT("struct"),
    ENUM("enum"),
    PROTOCOL("protocol"),
    EXTENSION("extension");

    private final String keyword;

    EntityKind(String keyword) {
        this.keyword = keyword;
    }

    /** The Swift keyword introducing this kind of declaration; also the serialized form. */
    @JsonValue
    public String keyword() {
        return keyword;
    }
}
