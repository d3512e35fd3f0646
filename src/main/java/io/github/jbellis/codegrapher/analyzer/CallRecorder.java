package io.github.jbellis.codegrapher.analyzer;

import org.treesitter.TSNode;

import java.util.Optional;

/**
 * Renders the callee of a call expression exactly as written, e.g. {@code player.play} for
 * {@code player.play(url)}. The reference is never resolved against declared entities.
 */
public final class CallRecorder {
    private final SwiftSyntaxProfile profile;

    public CallRecorder(SwiftSyntaxProfile profile) {
        this.profile = profile;
    }

    public Optional<String> callee(TSNode call, SyntaxTree tree) {
        for (TSNode child : SyntaxNodes.children(call)) {
            var type = child.getType();
            if (!child.isNamed() || profile.isComment(type)) {
                continue;
            }
            if (profile.callSuffixNodeType().equals(type)) {
                break;
            }
            var text = tree.text(child).strip();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        return Optional.empty();
    }
}
