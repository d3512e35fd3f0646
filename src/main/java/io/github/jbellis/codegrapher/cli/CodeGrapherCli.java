package io.github.jbellis.codegrapher.cli;

import io.github.jbellis.codegrapher.GrapherConfig;
import io.github.jbellis.codegrapher.graph.DuplicatePolicy;
import io.github.jbellis.codegrapher.graph.GraphBuilder;
import io.github.jbellis.codegrapher.graph.GraphWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "swift-code-grapher",
        mixinStandardHelpOptions = true,
        description = "Scans a directory of Swift sources and writes a JSON graph of its types, members and calls.")
public final class CodeGrapherCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CodeGrapherCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @CommandLine.Parameters(index = "0", paramLabel = "<projectDir>", description = "Root directory to scan.")
    private Path projectDir;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Output file (default: codegraph.json). Relative paths resolve against the working directory.")
    @Nullable
    private Path output;

    @CommandLine.Option(
            names = "--beside-project",
            description = "Resolve a relative output path against <projectDir> instead of the working directory.")
    @Nullable
    private Boolean besideProject;

    @CommandLine.Option(
            names = "--on-duplicate",
            description = "What to do when two types share a name: overwrite (default) or merge.")
    @Nullable
    private String onDuplicate;

    @CommandLine.Option(names = "--threads", description = "Number of parse workers (default: 1).")
    @Nullable
    private Integer threads;

    @CommandLine.Option(
            names = "--fail-fast",
            description = "Abort on the first file that cannot be read or parsed instead of skipping it.")
    @Nullable
    private Boolean failFast;

    @CommandLine.Option(
            names = "--exclude",
            description = "Glob of project-relative paths to skip, e.g. 'Pods/**'. Can be repeated.")
    @Nullable
    private List<String> excludes;

    @CommandLine.Option(names = "--config", description = "Properties file with default settings.")
    @Nullable
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /** Command line with usage errors mapped to exit code 1. */
    public static CommandLine newCommandLine() {
        var commandLine = new CommandLine(new CodeGrapherCli());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            var cl = ex.getCommandLine();
            cl.getErr().println("ERROR: " + ex.getMessage());
            cl.usage(cl.getErr());
            return EXIT_FAILURE;
        });
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            logger.error("Unexpected failure", ex);
            cl.getErr().println("ERROR: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        GrapherConfig config;
        try {
            config = resolveConfig();
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        var root = projectDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            logger.error("Not a directory: {}", root);
            return EXIT_FAILURE;
        }

        try {
            var result = new GraphBuilder(config).build(root);
            if (result.filesFound() == 0) {
                logger.info("No .swift files found in {}.", root);
                return EXIT_OK;
            }
            for (var failure : result.failures()) {
                logger.warn("Not graphed: {} ({})", failure.file(), failure.message());
            }

            var target = config.resolveOutput(root);
            new GraphWriter().write(result.graph(), target);
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            logger.error("Error: {}", e.getMessage());
            logger.debug("Failure detail", e);
            return EXIT_FAILURE;
        }
    }

    /** Defaults, then the --config file, then explicit options. */
    private GrapherConfig resolveConfig() throws IOException {
        var config = GrapherConfig.DEFAULTS;
        if (configFile != null) {
            config = config.withPropertiesFile(configFile);
        }
        return new GrapherConfig(
                output != null ? output : config.output(),
                besideProject != null ? besideProject : config.besideProject(),
                onDuplicate != null ? DuplicatePolicy.fromString(onDuplicate) : config.duplicatePolicy(),
                threads != null ? threads : config.threads(),
                failFast != null ? failFast : config.failFast(),
                excludes != null ? excludes : config.excludes());
    }
}
