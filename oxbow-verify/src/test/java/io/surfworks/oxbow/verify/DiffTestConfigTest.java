package io.surfworks.oxbow.verify;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DiffTestConfigTest {

    @Nested
    class Defaults {

        @Test
        void defaultValues() {
            DiffTestConfig config = DiffTestConfig.defaults();

            assertEquals("gcc", config.referenceCompiler());
            assertEquals("rustc", config.targetCompiler());
            assertEquals(Duration.ofSeconds(5), config.timeout());
            assertFalse(config.compareStderr());
        }

        @Test
        void configFileLocation() {
            Path file = DiffTestConfig.configFile();
            assertTrue(file.endsWith(Path.of(".config", "oxbow", "difftest.json")));
        }

        @Test
        void compilerPerSide() {
            DiffTestConfig config = DiffTestConfig.defaults();
            assertEquals("gcc", config.compilerFor(Side.ORIGINAL));
            assertEquals("rustc", config.compilerFor(Side.TRANSLATED));
        }
    }

    @Nested
    class Validation {

        @Test
        void rejectsBlankCompiler() {
            assertThrows(IllegalArgumentException.class,
                    () -> DiffTestConfig.defaults().withReferenceCompiler(" "));
            assertThrows(IllegalArgumentException.class,
                    () -> DiffTestConfig.defaults().withTargetCompiler(""));
        }

        @Test
        void rejectsNonPositiveTimeout() {
            assertThrows(IllegalArgumentException.class,
                    () -> DiffTestConfig.defaults().withTimeout(Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                    () -> DiffTestConfig.defaults().withTimeout(Duration.ofSeconds(-1)));
        }

        @Test
        void rejectsNull() {
            assertThrows(NullPointerException.class,
                    () -> new DiffTestConfig(null, "rustc", Duration.ofSeconds(1), false));
        }

        @Test
        void withMethodsReturnCopies() {
            DiffTestConfig base = DiffTestConfig.defaults();
            DiffTestConfig changed = base.withCompareStderr(true).withTargetCompiler("/opt/rust/bin/rustc");

            assertFalse(base.compareStderr());
            assertTrue(changed.compareStderr());
            assertEquals("/opt/rust/bin/rustc", changed.targetCompiler());
            assertEquals(base.referenceCompiler(), changed.referenceCompiler());
        }
    }

    @Nested
    class Loading {

        @TempDir
        Path dir;

        @Test
        void missingFileYieldsDefaults() {
            assertEquals(DiffTestConfig.defaults(), DiffTestConfigLoader.load(dir.resolve("absent.json")));
        }

        @Test
        void partialFileKeepsOtherDefaults() throws IOException {
            Path file = dir.resolve("difftest.json");
            Files.writeString(file, """
                {
                  "referenceCompiler": "clang",
                  "timeoutSeconds": 12
                }
                """);

            DiffTestConfig config = DiffTestConfigLoader.load(file);

            assertEquals("clang", config.referenceCompiler());
            assertEquals("rustc", config.targetCompiler());
            assertEquals(Duration.ofSeconds(12), config.timeout());
            assertFalse(config.compareStderr());
        }

        @Test
        void saveThenLoad() throws IOException {
            DiffTestConfig config = DiffTestConfig.defaults()
                    .withReferenceCompiler("/usr/bin/gcc-13")
                    .withTimeout(Duration.ofSeconds(30))
                    .withCompareStderr(true);
            Path file = dir.resolve("nested").resolve("difftest.json");

            DiffTestConfigLoader.save(config, file);

            assertEquals(config, DiffTestConfigLoader.load(file));
        }

        @Test
        void malformedFileYieldsDefaults() throws IOException {
            Path file = dir.resolve("difftest.json");
            Files.writeString(file, "{ not json");
            assertEquals(DiffTestConfig.defaults(), DiffTestConfigLoader.load(file));
        }

        @Test
        void invalidValueYieldsDefaults() throws IOException {
            Path file = dir.resolve("difftest.json");
            Files.writeString(file, "{ \"timeoutSeconds\": 0 }");
            assertEquals(DiffTestConfig.defaults(), DiffTestConfigLoader.load(file));
        }
    }
}
