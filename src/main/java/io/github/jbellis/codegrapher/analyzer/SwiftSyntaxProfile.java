package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.EntityKind;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Node type names of the tree-sitter Swift grammar that the extractor reacts to.
 *
 * @param typeDeclarationNodeTypes nodes that may introduce an entity; the kind comes from the keyword token
 * @param propertyNodeTypes        var/let bindings, including protocol requirements
 * @param functionNodeTypes        func declarations, including protocol requirements
 * @param callNodeType             call expressions
 * @param callSuffixNodeType       the argument part of a call, excluded from the callee text
 * @param parameterNodeType        one parameter of a function signature
 * @param inheritanceNodeType      one entry of an inheritance clause
 * @param patternNodeType          the bound name of a property
 * @param typeAnnotationNodeType   {@code : Type} following a bound name
 * @param commentNodeTypes         comments, skipped when reading tokens
 * @param kindsByKeyword           declaration keyword to entity kind
 */
public record SwiftSyntaxProfile(
        Set<String> typeDeclarationNodeTypes,
        Set<String> propertyNodeTypes,
        Set<String> functionNodeTypes,
        String callNodeType,
        String callSuffixNodeType,
        String parameterNodeType,
        String inheritanceNodeType,
        String patternNodeType,
        String typeAnnotationNodeType,
        Set<String> commentNodeTypes,
        Map<String, EntityKind> kindsByKeyword
) {
    public SwiftSyntaxProfile {
        Objects.requireNonNull(typeDeclarationNodeTypes);
        Objects.requireNonNull(propertyNodeTypes);
        Objects.requireNonNull(functionNodeTypes);
        Objects.requireNonNull(callNodeType);
        Objects.requireNonNull(callSuffixNodeType);
        Objects.requireNonNull(parameterNodeType);
        Objects.requireNonNull(inheritanceNodeType);
        Objects.requireNonNull(patternNodeType);
        Objects.requireNonNull(typeAnnotationNodeType);
        Objects.requireNonNull(commentNodeTypes);
        Objects.requireNonNull(kindsByKeyword);
    }

    public static final SwiftSyntaxProfile SWIFT = new SwiftSyntaxProfile(
            Set.of("class_declaration", "protocol_declaration"),
            Set.of("property_declaration", "protocol_property_declaration"),
            Set.of("function_declaration", "protocol_function_declaration"),
            "call_expression",
            "call_suffix",
            "parameter",
            "inheritance_specifier",
            "pattern",
            "type_annotation",
            Set.of("comment", "multiline_comment"),
            Map.of("class", EntityKind.CLASS,
                   "struct", EntityKind.STRUCT,
                   "enum", EntityKind.ENUM,
                   "protocol", EntityKind.PROTOCOL,
                   "extension", EntityKind.EXTENSION)
    );

    public boolean isTypeDeclaration(String nodeType) {
        return typeDeclarationNodeTypes.contains(nodeType);
    }

    public boolean isProperty(String nodeType) {
        return propertyNodeTypes.contains(nodeType);
    }

    public boolean isFunction(String nodeType) {
        return functionNodeTypes.contains(nodeType);
    }

    public boolean isCall(String nodeType) {
        return callNodeType.equals(nodeType);
    }

    public boolean isComment(String nodeType) {
        return commentNodeTypes.contains(nodeType);
    }
}
