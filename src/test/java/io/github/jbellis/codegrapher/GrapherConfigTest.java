package io.github.jbellis.codegrapher;

import io.github.jbellis.codegrapher.graph.DuplicatePolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class GrapherConfigTest {

    @Test
    void testDefaults() {
        var config = GrapherConfig.DEFAULTS;
        assertEquals(Path.of("codegraph.json"), config.output());
        assertFalse(config.besideProject());
        assertEquals(DuplicatePolicy.OVERWRITE, config.duplicatePolicy());
        assertEquals(1, config.threads());
        assertFalse(config.failFast());
        assertTrue(config.excludes().isEmpty());
    }

    @Test
    void testPropertiesOverrideOnlyWhatTheySet() {
        var props = new Properties();
        props.setProperty("onDuplicate", "merge");
        props.setProperty("threads", " 3 ");
        props.setProperty("exclude", "Pods/**, Carthage/**,,");

        var config = GrapherConfig.DEFAULTS.withProperties(props);
        assertEquals(DuplicatePolicy.MERGE, config.duplicatePolicy());
        assertEquals(3, config.threads());
        assertEquals(List.of("Pods/**", "Carthage/**"), config.excludes());
        assertEquals(GrapherConfig.DEFAULTS.output(), config.output());
        assertFalse(config.failFast());
    }

    @Test
    void testInvalidValuesAreRejected() {
        var badThreads = new Properties();
        badThreads.setProperty("threads", "many");
        assertThrows(IllegalArgumentException.class, () -> GrapherConfig.DEFAULTS.withProperties(badThreads));

        var zeroThreads = new Properties();
        zeroThreads.setProperty("threads", "0");
        assertThrows(IllegalArgumentException.class, () -> GrapherConfig.DEFAULTS.withProperties(zeroThreads));

        var badPolicy = new Properties();
        badPolicy.setProperty("onDuplicate", "ignore");
        assertThrows(IllegalArgumentException.class, () -> GrapherConfig.DEFAULTS.withProperties(badPolicy));
    }

    @Test
    void testPropertiesFile(@TempDir Path dir) throws Exception {
        var file = dir.resolve("grapher.properties");
        Files.writeString(file, "# settings\noutput=graph/out.json\nbesideProject=true\nfailFast=true\n");

        var config = GrapherConfig.DEFAULTS.withPropertiesFile(file);
        assertEquals(Path.of("graph/out.json"), config.output());
        assertTrue(config.besideProject());
        assertTrue(config.failFast());

        assertThrows(IOException.class, () -> GrapherConfig.DEFAULTS.withPropertiesFile(dir.resolve("missing.properties")));
    }

    @Test
    void testOutputResolution(@TempDir Path project) {
        var root = project.toAbsolutePath().normalize();
        var cwd = Path.of("").toAbsolutePath();

        assertEquals(cwd.resolve("codegraph.json"), GrapherConfig.DEFAULTS.resolveOutput(root));

        var beside = new GrapherConfig(Path.of("codegraph.json"), true, DuplicatePolicy.OVERWRITE, 1, false, List.of());
        assertEquals(root.resolve("codegraph.json"), beside.resolveOutput(root));

        var absolute = root.resolve("elsewhere/../graph.json");
        var fixed = new GrapherConfig(absolute, true, DuplicatePolicy.OVERWRITE, 1, false, List.of());
        assertEquals(root.resolve("graph.json"), fixed.resolveOutput(root));
    }
}
