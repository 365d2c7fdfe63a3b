package io.surfworks.oxbow.verify;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for differential testing.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Values set by the caller through the {@code with...} methods (highest priority)</li>
 *   <li>Config file ({@code ~/.config/oxbow/difftest.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param referenceCompiler C compiler command or path
 * @param targetCompiler    Rust compiler command or path
 * @param timeout           limit for each external process: each compile and each run
 * @param compareStderr     whether standard error differences are reported
 */
public record DiffTestConfig(
        String referenceCompiler,
        String targetCompiler,
        Duration timeout,
        boolean compareStderr
) {

    public static final String DEFAULT_REFERENCE_COMPILER = "gcc";

    public static final String DEFAULT_TARGET_COMPILER = "rustc";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "oxbow"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "difftest.json";

    public DiffTestConfig {
        Objects.requireNonNull(referenceCompiler, "referenceCompiler cannot be null");
        Objects.requireNonNull(targetCompiler, "targetCompiler cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");

        if (referenceCompiler.isBlank()) {
            throw new IllegalArgumentException("referenceCompiler cannot be blank");
        }
        if (targetCompiler.isBlank()) {
            throw new IllegalArgumentException("targetCompiler cannot be blank");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static DiffTestConfig defaults() {
        return new DiffTestConfig(DEFAULT_REFERENCE_COMPILER, DEFAULT_TARGET_COMPILER, DEFAULT_TIMEOUT, false);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Returns the compiler used for the given side.
     */
    public String compilerFor(Side side) {
        return side == Side.ORIGINAL ? referenceCompiler : targetCompiler;
    }

    public DiffTestConfig withReferenceCompiler(String compiler) {
        return new DiffTestConfig(compiler, targetCompiler, timeout, compareStderr);
    }

    public DiffTestConfig withTargetCompiler(String compiler) {
        return new DiffTestConfig(referenceCompiler, compiler, timeout, compareStderr);
    }

    public DiffTestConfig withTimeout(Duration limit) {
        return new DiffTestConfig(referenceCompiler, targetCompiler, limit, compareStderr);
    }

    public DiffTestConfig withCompareStderr(boolean compare) {
        return new DiffTestConfig(referenceCompiler, targetCompiler, timeout, compare);
    }
}
