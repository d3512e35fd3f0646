package io.github.jbellis.codegrapher.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Recursively enumerates the Swift sources under a project root, in a stable order.
 */
public final class SourceFileFinder {
    private static final Logger logger = LogManager.getLogger(SourceFileFinder.class);

    public static final String SWIFT_EXTENSION = "swift";

    private final List<PathMatcher> excludes;

    /**
     * @param excludeGlobs glob patterns (e.g. {@code Pods/**}) matched against project-relative paths
     */
    public SourceFileFinder(Collection<String> excludeGlobs) {
        var fs = FileSystems.getDefault();
        this.excludes = excludeGlobs.stream()
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .map(g -> fs.getPathMatcher("glob:" + g))
                .toList();
    }

    public SourceFileFinder() {
        this(List.of());
    }

    /**
     * Returns every regular {@code .swift} file below {@code root}, sorted by relative path.
     *
     * @throws IOException if the directory tree cannot be walked
     */
    public List<ProjectFile> find(Path root) throws IOException {
        var normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IOException("Not a directory: " + normalizedRoot);
        }

        try (Stream<Path> stream = Files.walk(normalizedRoot)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(p -> new ProjectFile(normalizedRoot, normalizedRoot.relativize(p)))
                    .peek(pf -> logger.trace("Found file: {}", pf))
                    .filter(pf -> SWIFT_EXTENSION.equals(pf.extension()))
                    .filter(pf -> {
                        if (isExcluded(pf)) {
                            logger.debug("Skipping excluded file: {}", pf);
                            return false;
                        }
                        return true;
                    })
                    .sorted()
                    .toList();
        }
    }

    private boolean isExcluded(ProjectFile file) {
        var rel = file.getRelPath();
        return excludes.stream().anyMatch(m -> m.matches(rel));
    }
}
