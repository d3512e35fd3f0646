package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.CodeEntity;
import io.github.jbellis.codegrapher.model.EntityKind;
import io.github.jbellis.codegrapher.model.PropertyInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable entity under construction while its declaration is being walked.
 */
public final class EntityDraft {
    private final String name;
    private final EntityKind kind;
    private final List<String> inheritedTypes;
    private final List<String> conformedProtocols;
    private final List<PropertyInfo> properties = new ArrayList<>();
    private final List<MethodDraft> methods = new ArrayList<>();

    EntityDraft(String name, EntityKind kind, List<String> inheritedTypes, List<String> conformedProtocols) {
        this.name = name;
        this.kind = kind;
        this.inheritedTypes = List.copyOf(inheritedTypes);
        this.conformedProtocols = List.copyOf(conformedProtocols);
    }

    public String name() {
        return name;
    }

    public EntityKind kind() {
        return kind;
    }

    public List<String> inheritedTypes() {
        return inheritedTypes;
    }

    public List<String> conformedProtocols() {
        return conformedProtocols;
    }

    void addProperty(PropertyInfo property) {
        properties.add(property);
    }

    void addMethod(MethodDraft method) {
        methods.add(method);
    }

    CodeEntity toEntity() {
        return new CodeEntity(name,
                              kind,
                              inheritedTypes,
                              conformedProtocols,
                              properties,
                              methods.stream().map(MethodDraft::toMethod).toList());
    }
}
