package io.github.jbellis.codegrapher.analyzer;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstraction for a source filename relative to the scanned project root. Exists so that files found
 * by different walks compare equal and sort the same way, unlike bare Paths which may or may not be
 * absolute.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /**
     * root must be absolute and pre-normalized; we will normalize relPath if it is not already
     */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    /** Reads the file as UTF-8; malformed input is reported as an IOException. */
    public String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    /**
     * Just the filename, no path at all
     */
    public String getFileName() {
        return absPath().getFileName().toString();
    }

    /** return the (lowercased) extension [not including the dot] */
    public String extension() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(java.util.Locale.ROOT);
        }
        return "";
    }

    /** Project-relative path with forward slashes, used for ordering and exclusion matching. */
    public String relName() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(@NotNull ProjectFile o) {
        return relName().compareTo(o.relName());
    }

    @Override
    public String toString() {
        return relName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) &&
               Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
