package io.github.jbellis.codegrapher.graph;

/**
 * A failure that aborts the whole run; no graph is produced.
 */
public class GraphBuildException extends RuntimeException {
    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
