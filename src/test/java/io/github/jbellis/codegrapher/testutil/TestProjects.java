package io.github.jbellis.codegrapher.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Project directories for builder and command line tests.
 */
public final class TestProjects {
    private TestProjects() {
    }

    /** The sample app under src/test/resources/{subDir}, as an absolute path. */
    public static Path fixture(String subDir) {
        Path testDir = Path.of("src/test/resources", subDir);
        assertTrue(Files.exists(testDir), "Test resource dir missing: " + testDir);
        assertTrue(Files.isDirectory(testDir), testDir + " is not a directory");
        return testDir.toAbsolutePath().normalize();
    }

    public static Path swiftApp() {
        return fixture("testcode-swift");
    }

    /** Writes {@code content} to {@code root/relName}, creating parent directories. */
    public static Path write(Path root, String relName, String content) throws IOException {
        var file = root.resolve(relName);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
