package io.github.jbellis.codegrapher.graph;

import io.github.jbellis.codegrapher.analyzer.ProjectFile;

import java.util.List;

/**
 * Outcome of a run.
 *
 * @param filesFound     number of Swift files discovered
 * @param failures       files skipped because they could not be read or parsed
 * @param parseWarnings  files graphed from a tree that contained syntax errors
 */
public record GraphBuildResult(CodeGraph graph, int filesFound, List<FileFailure> failures, int parseWarnings) {
    public GraphBuildResult {
        failures = List.copyOf(failures);
    }

    public record FileFailure(ProjectFile file, String message) {
    }

    public int filesGraphed() {
        return filesFound - failures.size();
    }
}
