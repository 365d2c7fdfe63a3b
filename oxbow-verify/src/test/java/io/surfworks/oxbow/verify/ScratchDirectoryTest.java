package io.surfworks.oxbow.verify;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScratchDirectoryTest {

    @Test
    void deletesTreeOnClose() throws IOException {
        Path root;
        try (ScratchDirectory scratch = ScratchDirectory.create("oxbow-test-")) {
            root = scratch.path();
            Files.writeString(scratch.resolve("input.c"), "int main(void) { return 0; }");
            Files.createDirectories(scratch.resolve("nested").resolve("deeper"));
            Files.writeString(root.resolve("nested").resolve("deeper").resolve("file"), "x");
            assertTrue(Files.isDirectory(root));
        }
        assertFalse(Files.exists(root));
    }

    @Test
    void deletesOnExceptionalExit() throws IOException {
        Path[] seen = new Path[1];
        assertThrows(IllegalStateException.class, () -> {
            try (ScratchDirectory scratch = ScratchDirectory.create("oxbow-test-")) {
                seen[0] = scratch.path();
                Files.writeString(scratch.resolve("input.rs"), "fn main() {}");
                throw new IllegalStateException("boom");
            }
        });
        assertFalse(Files.exists(seen[0]));
    }

    @Test
    void namesAreUnique() throws IOException {
        try (ScratchDirectory a = ScratchDirectory.create("oxbow-test-");
             ScratchDirectory b = ScratchDirectory.create("oxbow-test-")) {
            assertNotEquals(a.path(), b.path());
            assertTrue(a.path().getFileName().toString().startsWith("oxbow-test-"));
        }
    }

    @Test
    void closeIsIdempotentAndResolveFailsAfterClose() throws IOException {
        ScratchDirectory scratch = ScratchDirectory.create("oxbow-test-");
        scratch.close();
        scratch.close();
        assertThrows(IllegalStateException.class, () -> scratch.resolve("input.c"));
    }

    @Test
    void toleratesDirectoryAlreadyGone() throws IOException {
        ScratchDirectory scratch = ScratchDirectory.create("oxbow-test-");
        Files.delete(scratch.path());
        assertDoesNotThrow(scratch::close);
    }
}
