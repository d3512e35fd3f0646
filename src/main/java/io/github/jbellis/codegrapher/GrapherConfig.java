package io.github.jbellis.codegrapher;

import io.github.jbellis.codegrapher.graph.DuplicatePolicy;
import io.github.jbellis.codegrapher.graph.GraphWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Settings for one run.
 *
 * @param output          where the graph is written; a relative path resolves against the working directory,
 *                        or against the scanned project when {@code besideProject} is set
 * @param besideProject   resolve a relative output path against the scanned project instead of the working directory
 * @param duplicatePolicy what happens when two entities share a name
 * @param threads         parse workers; 1 processes files one at a time
 * @param failFast        abort the run on the first unreadable or unparsable file instead of skipping it
 * @param excludes        globs of project-relative paths to leave out
 */
public record GrapherConfig(Path output,
                            boolean besideProject,
                            DuplicatePolicy duplicatePolicy,
                            int threads,
                            boolean failFast,
                            List<String> excludes) {
    private static final Logger logger = LogManager.getLogger(GrapherConfig.class);

    public static final String OUTPUT_KEY = "output";
    public static final String BESIDE_PROJECT_KEY = "besideProject";
    public static final String DUPLICATE_POLICY_KEY = "onDuplicate";
    public static final String THREADS_KEY = "threads";
    public static final String FAIL_FAST_KEY = "failFast";
    public static final String EXCLUDE_KEY = "exclude";

    public static final GrapherConfig DEFAULTS = new GrapherConfig(
            Path.of(GraphWriter.DEFAULT_FILE_NAME), false, DuplicatePolicy.OVERWRITE, 1, false, List.of());

    public GrapherConfig {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        excludes = List.copyOf(excludes);
    }

    /**
     * Layers the keys present in {@code props} over this config; absent keys keep their current value.
     * {@code exclude} is a comma-separated list.
     */
    public GrapherConfig withProperties(Properties props) {
        var out = props.containsKey(OUTPUT_KEY) ? Path.of(props.getProperty(OUTPUT_KEY).trim()) : output;
        var beside = props.containsKey(BESIDE_PROJECT_KEY)
                ? Boolean.parseBoolean(props.getProperty(BESIDE_PROJECT_KEY).trim())
                : besideProject;
        var policy = props.containsKey(DUPLICATE_POLICY_KEY)
                ? DuplicatePolicy.fromString(props.getProperty(DUPLICATE_POLICY_KEY))
                : duplicatePolicy;
        int workers = threads;
        if (props.containsKey(THREADS_KEY)) {
            try {
                workers = Integer.parseInt(props.getProperty(THREADS_KEY).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + THREADS_KEY + ": " + props.getProperty(THREADS_KEY), e);
            }
        }
        var fast = props.containsKey(FAIL_FAST_KEY)
                ? Boolean.parseBoolean(props.getProperty(FAIL_FAST_KEY).trim())
                : failFast;
        var globs = props.containsKey(EXCLUDE_KEY)
                ? Arrays.stream(props.getProperty(EXCLUDE_KEY).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList()
                : excludes;
        return new GrapherConfig(out, beside, policy, workers, fast, globs);
    }

    /**
     * Loads {@code file} as a properties file and layers it over this config.
     *
     * @throws IOException if the file does not exist or cannot be read
     */
    public GrapherConfig withPropertiesFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        logger.debug("Loaded {} settings from {}", props.size(), file);
        return withProperties(props);
    }

    /** Absolute output location for a run over {@code projectRoot}. */
    public Path resolveOutput(Path projectRoot) {
        if (output.isAbsolute()) {
            return output.normalize();
        }
        var base = besideProject ? projectRoot : Path.of("");
        return base.resolve(output).toAbsolutePath().normalize();
    }
}
