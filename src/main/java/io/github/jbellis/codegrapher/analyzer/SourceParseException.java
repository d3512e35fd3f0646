package io.github.jbellis.codegrapher.analyzer;

/**
 * Thrown when the parser produces no usable syntax tree for a source file.
 */
public class SourceParseException extends RuntimeException {
    private final ProjectFile file;

    public SourceParseException(ProjectFile file, String message) {
        super("Failed to parse " + file + ": " + message);
        this.file = file;
    }

    public ProjectFile getFile() {
        return file;
    }
}
