package io.github.jbellis.codegrapher.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A function declared in an entity body together with the raw callee text of every call it makes.
 * {@code calls} keeps duplicates, in the order the calls appear in the source.
 */
@JsonPropertyOrder({"name", "parameters", "returnType", "calls"})
public record MethodInfo(String name,
                         List<ParameterInfo> parameters,
                         @Nullable String returnType,
                         List<String> calls) {
    public MethodInfo {
        Objects.requireNonNull(name, "name must not be null");
        parameters = List.copyOf(parameters);
        calls = List.copyOf(calls);
    }
}
