package io.github.jbellis.codegrapher.graph;

import io.github.jbellis.codegrapher.GrapherConfig;
import io.github.jbellis.codegrapher.analyzer.DeclarationWalker;
import io.github.jbellis.codegrapher.analyzer.FileExtraction;
import io.github.jbellis.codegrapher.analyzer.ProjectFile;
import io.github.jbellis.codegrapher.analyzer.SourceFileFinder;
import io.github.jbellis.codegrapher.analyzer.SwiftParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the graph for a project directory: finds the Swift files, parses and walks each one (on worker
 * threads when configured), and registers the results into one {@link CodeGraph}.
 * <p>
 * Files are parsed independently, but registration happens only on the calling thread and always in sorted
 * file order, so which same-named entity survives does not depend on the number of workers.
 */
public final class GraphBuilder {
    private static final Logger logger = LogManager.getLogger(GraphBuilder.class);

    private final GrapherConfig config;
    private final SourceFileFinder finder;
    private final SwiftParser parser;
    private final DeclarationWalker walker;

    public GraphBuilder(GrapherConfig config) {
        this(config, new SourceFileFinder(config.excludes()), new SwiftParser(), new DeclarationWalker());
    }

    GraphBuilder(GrapherConfig config, SourceFileFinder finder, SwiftParser parser, DeclarationWalker walker) {
        this.config = config;
        this.finder = finder;
        this.parser = parser;
        this.walker = walker;
    }

    /**
     * Scans {@code projectRoot} and builds its graph.
     *
     * @throws IOException         if the directory cannot be walked
     * @throws GraphBuildException if a file fails in fail-fast mode, or the run is interrupted
     */
    public GraphBuildResult build(Path projectRoot) throws IOException {
        logger.info("Scanning directory: {}", projectRoot.toAbsolutePath().normalize());
        var files = finder.find(projectRoot);
        var graph = new CodeGraph(config.duplicatePolicy());
        if (files.isEmpty()) {
            return new GraphBuildResult(graph, 0, List.of(), 0);
        }
        return build(files, graph);
    }

    /** Parses {@code files} and registers them into {@code graph} in list order. */
    GraphBuildResult build(List<ProjectFile> files, CodeGraph graph) {
        var failures = new ArrayList<GraphBuildResult.FileFailure>();
        int parseWarnings = 0;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.threads(), files.size()), workerThreads());
        try {
            var pending = new ArrayList<Future<FileExtraction>>(files.size());
            for (ProjectFile file : files) {
                pending.add(pool.submit(() -> extract(file)));
            }

            for (int i = 0; i < files.size(); i++) {
                var file = files.get(i);
                FileExtraction extraction;
                try {
                    extraction = pending.get(i).get();
                } catch (ExecutionException e) {
                    var cause = e.getCause() != null ? e.getCause() : e;
                    if (config.failFast()) {
                        throw new GraphBuildException("Failed to process " + file + ": " + describe(cause), cause);
                    }
                    logger.warn("Skipping {}: {}", file, describe(cause));
                    logger.debug("Failure detail for {}", file, cause);
                    failures.add(new GraphBuildResult.FileFailure(file, describe(cause)));
                    continue;
                }
                if (extraction.hasSyntaxErrors()) {
                    parseWarnings++;
                }
                graph.registerAll(extraction);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphBuildException("Interrupted while building the graph", e);
        } finally {
            pool.shutdownNow();
        }

        logger.info("Graphed {} of {} files: {} entities, {} skipped, {} with syntax errors",
                    files.size() - failures.size(), files.size(), graph.size(), failures.size(), parseWarnings);
        return new GraphBuildResult(graph, files.size(), failures, parseWarnings);
    }

    private FileExtraction extract(ProjectFile file) throws IOException {
        logger.info("Parsing {}", file);
        var tree = parser.parse(file);
        return walker.walk(tree);
    }

    private static String describe(Throwable t) {
        var msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var thread = new Thread(r, "grapher-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
