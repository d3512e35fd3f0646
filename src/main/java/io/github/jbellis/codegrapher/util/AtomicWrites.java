package io.github.jbellis.codegrapher.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicWrites {
    private AtomicWrites() {
    }

    /**
     * Overwrites the content of a file with the provided text, UTF-8 encoded.
     * <p>
     * The content goes to a temporary file in the target's directory first and is then moved over the
     * target, atomically where the filesystem supports it, so readers never see a half-written graph.
     *
     * @param targetPath absolute path of the file to overwrite; its directory is created if missing
     * @param content    the text content to write
     * @throws IOException if an I/O error occurs during writing or moving the file
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "temp-", ".tmp");

        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, targetPath,
                           StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}
