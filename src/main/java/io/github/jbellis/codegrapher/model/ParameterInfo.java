package io.github.jbellis.codegrapher.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One parameter of a method signature.
 *
 * @param externalName the argument label, present only when the declaration spells out both a label and a name
 * @param internalName the name used inside the function body
 * @param type         the rendered type annotation, or null if it rendered empty
 */
@JsonPropertyOrder({"externalName", "internalName", "type"})
public record ParameterInfo(@Nullable String externalName, String internalName, @Nullable String type) {
    public ParameterInfo {
        Objects.requireNonNull(internalName, "internalName must not be null");
    }
}
