package io.github.jbellis.codegrapher.analyzer;

import io.github.jbellis.codegrapher.model.MethodInfo;
import io.github.jbellis.codegrapher.model.ParameterInfo;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A method whose body is still being walked; calls are appended as they are reached.
 */
final class MethodDraft {
    private final String name;
    private final List<ParameterInfo> parameters;
    private final @Nullable String returnType;
    private final List<String> calls = new ArrayList<>();

    MethodDraft(String name, SignatureExtractor.Signature signature) {
        this.name = name;
        this.parameters = signature.parameters();
        this.returnType = signature.returnType();
    }

    void addCall(String callee) {
        calls.add(callee);
    }

    MethodInfo toMethod() {
        return new MethodInfo(name, parameters, returnType, calls);
    }
}
