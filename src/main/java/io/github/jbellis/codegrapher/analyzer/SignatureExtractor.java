package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.ParameterInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the parameter clause and return clause of a function declaration.
 */
public final class SignatureExtractor {
    private static final Logger logger = LogManager.getLogger(SignatureExtractor.class);

    private static final String VARIADIC_SUFFIX = "...";

    /**
     * @param returnType text after {@code ->}, or null when the signature has no return clause
     */
    public record Signature(List<ParameterInfo> parameters, @Nullable String returnType) {
        public Signature {
            parameters = List.copyOf(parameters);
        }
    }

    private final SwiftSyntaxProfile profile;

    public SignatureExtractor(SwiftSyntaxProfile profile) {
        this.profile = profile;
    }

    /** The function's simple name, e.g. {@code viewDidLoad} or an operator such as {@code ==}. */
    public Optional<String> functionName(TSNode function, SyntaxTree tree) {
        var nameNode = SyntaxNodes.field(function, "name");
        if (nameNode != null) {
            var name = tree.text(nameNode).strip();
            return name.isEmpty() ? Optional.empty() : Optional.of(name);
        }
        boolean afterFunc = false;
        for (TSNode child : SyntaxNodes.children(function)) {
            if (!child.isNamed() && "func".equals(child.getType())) {
                afterFunc = true;
            } else if (afterFunc && !profile.isComment(child.getType())) {
                var name = tree.text(child).strip();
                return name.isEmpty() ? Optional.empty() : Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public Signature extract(TSNode function, SyntaxTree tree) {
        var parameters = new ArrayList<ParameterInfo>();
        for (TSNode child : SyntaxNodes.children(function)) {
            if (profile.parameterNodeType().equals(child.getType())) {
                parameter(child, tree).ifPresent(parameters::add);
            }
        }
        return new Signature(parameters, returnType(function, tree));
    }

    /**
     * Names before the colon (label then name, or just the name) and the type text after it.
     * The type keeps ownership modifiers such as {@code inout} but drops a trailing variadic {@code ...}.
     */
    Optional<ParameterInfo> parameter(TSNode parameter, SyntaxTree tree) {
        var names = new ArrayList<String>(2);
        int typeStart = -1;
        for (TSNode child : SyntaxNodes.children(parameter)) {
            if (!child.isNamed() && ":".equals(child.getType())) {
                typeStart = child.getEndByte();
                break;
            }
            if (profile.isComment(child.getType())) {
                continue;
            }
            var text = tree.text(child).strip();
            if (!text.isEmpty()) {
                names.add(text);
            }
        }

        if (names.isEmpty()) {
            logger.debug("Parameter without a name in {}: '{}'", tree.file(), tree.text(parameter).strip());
            return Optional.empty();
        }

        String externalName = names.size() >= 2 ? names.get(0) : null;
        String internalName = names.size() >= 2 ? names.get(1) : names.get(0);

        String type = null;
        if (typeStart >= 0) {
            var rendered = tree.text(typeStart, parameter.getEndByte()).strip();
            if (rendered.endsWith(VARIADIC_SUFFIX)) {
                rendered = rendered.substring(0, rendered.length() - VARIADIC_SUFFIX.length()).strip();
            }
            type = rendered.isEmpty() ? null : rendered;
        }
        return Optional.of(new ParameterInfo(externalName, internalName, type));
    }

    /** Text of the type following {@code ->}; null when there is no arrow, never empty. */
    @Nullable
    String returnType(TSNode function, SyntaxTree tree) {
        var returnNode = SyntaxNodes.field(function, "return_type");
        if (returnNode == null) {
            boolean afterArrow = false;
            for (TSNode child : SyntaxNodes.children(function)) {
                if (!child.isNamed() && "->".equals(child.getType())) {
                    afterArrow = true;
                } else if (afterArrow && child.isNamed() && !profile.isComment(child.getType())) {
                    returnNode = child;
                    break;
                }
            }
        }
        if (returnNode == null) {
            return null;
        }
        var rendered = tree.text(returnNode).strip();
        return rendered.isEmpty() ? null : rendered;
    }
}
