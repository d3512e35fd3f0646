package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.PropertyInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Depth-first, pre-order walk over one file's syntax tree that turns type declarations into entities,
 * their member bindings into properties, their member functions into methods, and calls made inside those
 * functions into call references.
 * <p>
 * Open declarations are kept on a stack of frames, one per entity, each holding its own stack of open
 * methods. A type nested inside another declaration pushes its own frame and, once it is exited, members and
 * calls are attributed to the outer entity and method again.
 * <p>
 * Every var/let binding and every func declared while an entity is open belongs to the innermost entity,
 * including locals inside a method body. A local function is recorded as a method of its own: calls in its
 * body are attributed to it, and calls after it to the enclosing method.
 */
public final class DeclarationWalker {
    private static final Logger logger = LogManager.getLogger(DeclarationWalker.class);

    private static final Pattern IDENTIFIER = Pattern.compile("`?[\\p{L}_$][\\p{L}\\p{N}_$]*`?");

    private final SwiftSyntaxProfile profile;
    private final EntityBuilder entityBuilder;
    private final SignatureExtractor signatureExtractor;
    private final CallRecorder callRecorder;

    public DeclarationWalker() {
        this(SwiftSyntaxProfile.SWIFT);
    }

    public DeclarationWalker(SwiftSyntaxProfile profile) {
        this.profile = profile;
        this.entityBuilder = new EntityBuilder(profile);
        this.signatureExtractor = new SignatureExtractor(profile);
        this.callRecorder = new CallRecorder(profile);
    }

    /** One open entity and the functions currently being walked inside it, innermost first. */
    private static final class Frame {
        final EntityDraft entity;
        final Deque<MethodDraft> openMethods = new ArrayDeque<>();

        Frame(EntityDraft entity) {
            this.entity = entity;
        }
    }

    /** Per-walk state; a walker instance holds none so it can be shared across threads. */
    private static final class WalkState {
        final SyntaxTree tree;
        final Deque<Frame> frames = new ArrayDeque<>();
        final List<EntityDraft> registered = new ArrayList<>();

        WalkState(SyntaxTree tree) {
            this.tree = tree;
        }
    }

    /**
     * Walks the whole tree and returns its entities in the order their declarations were entered.
     * Same-named entities are all returned; deciding which survives is up to the graph.
     */
    public FileExtraction walk(SyntaxTree tree) {
        var state = new WalkState(tree);
        visit(tree.root(), state);
        var entities = state.registered.stream().map(EntityDraft::toEntity).toList();
        logger.debug("Extracted {} entities from {}", entities.size(), tree.file());
        return new FileExtraction(tree.file(), entities, tree.hasErrors());
    }

    private void visit(TSNode node, WalkState state) {
        var type = node.getType();
        boolean pushedFrame = false;
        boolean openedMethod = false;

        if (profile.isTypeDeclaration(type)) {
            var draft = entityBuilder.build(node, state.tree);
            if (draft.isPresent()) {
                state.registered.add(draft.get());
                state.frames.push(new Frame(draft.get()));
                pushedFrame = true;
            }
        } else if (profile.isProperty(type)) {
            var frame = state.frames.peek();
            if (frame != null) {
                for (PropertyInfo property : properties(node, state.tree)) {
                    frame.entity.addProperty(property);
                }
            }
        } else if (profile.isFunction(type)) {
            var frame = state.frames.peek();
            if (frame != null) {
                var name = signatureExtractor.functionName(node, state.tree);
                if (name.isPresent()) {
                    var method = new MethodDraft(name.get(), signatureExtractor.extract(node, state.tree));
                    frame.entity.addMethod(method);
                    frame.openMethods.push(method);
                    openedMethod = true;
                } else {
                    logger.debug("Skipping unnamed function at line {} in {}",
                                 node.getStartPoint().getRow() + 1, state.tree.file());
                }
            }
        } else if (profile.isCall(type)) {
            var frame = state.frames.peek();
            var method = frame != null ? frame.openMethods.peek() : null;
            if (method != null) {
                callRecorder.callee(node, state.tree).ifPresent(method::addCall);
            }
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            var child = node.getChild(i);
            if (SyntaxNodes.isPresent(child)) {
                visit(child, state);
            }
        }

        if (openedMethod) {
            var frame = state.frames.peek();
            if (frame != null) {
                frame.openMethods.pop();
            }
        }
        if (pushedFrame) {
            state.frames.pop();
        }
    }

    /**
     * One property per identifier binding: {@code var x = 1, y: Int = 2} yields {@code x: Unknown} and
     * {@code y: Int}. Destructuring patterns such as {@code let (a, b) = pair} bind no single name and are
     * skipped.
     */
    List<PropertyInfo> properties(TSNode declaration, SyntaxTree tree) {
        var result = new ArrayList<PropertyInfo>();
        String pendingName = null;
        String pendingType = null;
        boolean expectingName = true;

        for (TSNode child : SyntaxNodes.children(declaration)) {
            var type = child.getType();
            if (!child.isNamed() && ",".equals(type)) {
                if (pendingName != null) {
                    result.add(new PropertyInfo(pendingName, pendingType != null ? pendingType : PropertyInfo.UNKNOWN_TYPE));
                }
                pendingName = null;
                pendingType = null;
                expectingName = true;
                continue;
            }
            if (expectingName && (profile.patternNodeType().equals(type) || "simple_identifier".equals(type))) {
                var text = boundName(child, tree);
                pendingName = IDENTIFIER.matcher(text).matches() && !"_".equals(text) ? text : null;
                pendingType = null;
                expectingName = false;
                continue;
            }
            if (!expectingName && pendingName != null && pendingType == null
                && profile.typeAnnotationNodeType().equals(type)) {
                pendingType = annotatedType(child, tree);
            }
        }
        if (pendingName != null) {
            result.add(new PropertyInfo(pendingName, pendingType != null ? pendingType : PropertyInfo.UNKNOWN_TYPE));
        }
        return result;
    }

    /**
     * The identifier a pattern binds. A protocol requirement's pattern spans {@code var name}, so the name is
     * read from its {@code bound_identifier} field, or else from its last identifier child.
     */
    private String boundName(TSNode pattern, SyntaxTree tree) {
        var bound = SyntaxNodes.field(pattern, "bound_identifier");
        if (bound == null) {
            for (TSNode child : SyntaxNodes.children(pattern)) {
                if ("simple_identifier".equals(child.getType())) {
                    bound = child;
                }
            }
        }
        return tree.text(bound != null ? bound : pattern).strip();
    }

    /** The type of a {@code : Type} annotation as written (so {@code Int!} keeps its bang), or null if empty. */
    private @Nullable String annotatedType(TSNode annotation, SyntaxTree tree) {
        var rendered = tree.text(annotation).strip();
        if (rendered.startsWith(":")) {
            rendered = rendered.substring(1).strip();
        }
        return rendered.isEmpty() ? null : rendered;
    }
}
