package io.surfworks.oxbow.verify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Shell-script stand-ins for gcc and rustc.
 *
 * <p>The fake compilers copy their "source" to the output path and mark it executable,
 * so a source text that is itself a shell script becomes the binary that runs.
 */
final class FakeToolchain {

    private FakeToolchain() {}

    static boolean shellAvailable() {
        return Files.isExecutable(Path.of("/bin/sh"));
    }

    /** Accepts: -o BIN -x c -std=c99 SRC -lm */
    static Path gcc(Path dir) throws IOException {
        return script(dir, "fake-gcc", "cp \"$6\" \"$2\" && chmod +x \"$2\"");
    }

    /** Accepts: --edition=2021 -o BIN SRC */
    static Path rustc(Path dir) throws IOException {
        return script(dir, "fake-rustc", "cp \"$4\" \"$3\" && chmod +x \"$3\"");
    }

    static Path failing(Path dir, String diagnostic) throws IOException {
        return script(dir, "fake-failing", "pwd >&2\necho '" + diagnostic + "' >&2\nexit 1");
    }

    static Path silent(Path dir) throws IOException {
        return script(dir, "fake-silent", "exit 0");
    }

    static Path script(Path dir, String name, String body) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
        return path;
    }

    /** A "program" for the fake compilers: a shell script. */
    static String program(String body) {
        return "#!/bin/sh\n" + body + "\n";
    }

    static DiffTestConfig config(Path gcc, Path rustc) {
        return DiffTestConfig.defaults()
                .withReferenceCompiler(gcc.toString())
                .withTargetCompiler(rustc.toString());
    }
}
