package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.CodeEntity;
import io.github.jbellis.codegrapher.model.EntityKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a type declaration node into an {@link EntityDraft}: its graph name, kind and inheritance clause.
 * <p>
 * The inheritance clause is partitioned by position only. The grammar does not tell a superclass apart
 * from a protocol, so the first entry is reported as an inherited type and every other entry as a
 * conformed protocol. This is a heuristic: {@code struct S: Equatable} reports {@code Equatable} as
 * inherited. Extensions are the exception, since they cannot add a superclass: all of their entries are
 * conformed protocols.
 */
public final class EntityBuilder {
    private static final Logger logger = LogManager.getLogger(EntityBuilder.class);

    private static final Set<String> NAME_NODE_TYPES = Set.of("type_identifier", "user_type", "simple_identifier");

    private final SwiftSyntaxProfile profile;

    public EntityBuilder(SwiftSyntaxProfile profile) {
        this.profile = profile;
    }

    /**
     * Builds the draft for {@code declaration}, or returns empty when the node is not one of the entity kinds
     * (e.g. an actor) or carries no name.
     */
    public Optional<EntityDraft> build(TSNode declaration, SyntaxTree tree) {
        var kind = kindOf(declaration);
        if (kind.isEmpty()) {
            logger.trace("Ignoring {} without an entity keyword in {}", declaration.getType(), tree.file());
            return Optional.empty();
        }

        String name;
        if (kind.get() == EntityKind.EXTENSION) {
            var extended = declaredName(declaration, tree);
            name = CodeEntity.extensionName(extended.isEmpty() ? "Unknown" : extended);
        } else {
            name = declaredName(declaration, tree);
            if (name.isEmpty()) {
                logger.warn("Could not determine the name of {} at line {} in {}",
                            kind.get().keyword(), declaration.getStartPoint().getRow() + 1, tree.file());
                return Optional.empty();
            }
        }

        var inherited = new ArrayList<String>();
        var protocols = new ArrayList<String>();
        var clause = inheritanceClause(declaration, tree);
        for (int i = 0; i < clause.size(); i++) {
            // an extension cannot introduce a superclass, so its whole clause is conformances
            if (i == 0 && kind.get() != EntityKind.EXTENSION) {
                inherited.add(clause.get(i));
            } else {
                protocols.add(clause.get(i));
            }
        }

        logger.trace("Entity {} ({}) inherits {} conforms {}", name, kind.get().keyword(), inherited, protocols);
        return Optional.of(new EntityDraft(name, kind.get(), inherited, protocols));
    }

    /** The kind named by the declaration's keyword token, e.g. {@code struct} in {@code public struct S}. */
    Optional<EntityKind> kindOf(TSNode declaration) {
        for (TSNode child : SyntaxNodes.children(declaration)) {
            if (child.isNamed()) {
                continue;
            }
            var kind = profile.kindsByKeyword().get(child.getType());
            if (kind != null) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /** The declared identifier, or for an extension the extended type as written; trimmed. */
    private String declaredName(TSNode declaration, SyntaxTree tree) {
        @Nullable TSNode nameNode = SyntaxNodes.field(declaration, "name");
        if (nameNode == null) {
            for (TSNode child : SyntaxNodes.children(declaration)) {
                if (NAME_NODE_TYPES.contains(child.getType())) {
                    nameNode = child;
                    break;
                }
            }
        }
        return nameNode == null ? "" : tree.text(nameNode).strip();
    }

    /** Type names of the inheritance clause in declaration order. */
    List<String> inheritanceClause(TSNode declaration, SyntaxTree tree) {
        var names = new ArrayList<String>();
        for (TSNode child : SyntaxNodes.children(declaration)) {
            if (!profile.inheritanceNodeType().equals(child.getType())) {
                continue;
            }
            var inheritsFrom = SyntaxNodes.field(child, "inherits_from");
            var typeName = tree.text(inheritsFrom != null ? inheritsFrom : child).strip();
            if (!typeName.isEmpty()) {
                names.add(typeName);
            }
        }
        return names;
    }
}
