package io.surfworks.oxbow.verify;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.logging.Logger;

/**
 * A uniquely named temporary directory, deleted with everything in it on {@link #close()}.
 *
 * <p>Use with try-with-resources so the directory goes away on every exit path:
 * <pre>{@code
 * try (ScratchDirectory scratch = ScratchDirectory.create("oxbow-c-")) {
 *     Path source = scratch.resolve("input.c");
 *     ...
 * }
 * }</pre>
 */
public final class ScratchDirectory implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ScratchDirectory.class.getName());

    private final Path path;
    private boolean closed;

    private ScratchDirectory(Path path) {
        this.path = path;
    }

    /**
     * Creates a fresh directory under the system temp directory.
     *
     * @param prefix directory name prefix
     * @throws IOException if the directory cannot be created
     */
    public static ScratchDirectory create(String prefix) throws IOException {
        Path dir = Files.createTempDirectory(prefix);
        LOG.fine(() -> "Created scratch directory " + dir);
        return new ScratchDirectory(dir);
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        if (closed) {
            throw new IllegalStateException("Scratch directory already closed: " + path);
        }
        return path.resolve(name);
    }

    /**
     * Deletes the directory tree. Failures are logged; closing twice is a no-op.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            deleteTree(path);
            LOG.fine(() -> "Deleted scratch directory " + path);
        } catch (IOException e) {
            LOG.warning(() -> "Failed to delete scratch directory " + path + ": " + e.getMessage());
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
