package io.surfworks.oxbow.verify;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Proves a translation behaviorally equivalent to its original by compiling both,
 * running both with no arguments and comparing what they print and how they exit.
 *
 * <p>Each side is compiled inside its own {@link ScratchDirectory} holding exactly one
 * source file and one binary; both directories are deleted on every exit path. The
 * tester holds no mutable state, so one instance may serve concurrent callers.
 *
 * <p>Example usage:
 * <pre>{@code
 * DifferentialTester tester = new DifferentialTester(DiffTestConfig.defaults());
 * DiffResult result = tester.diffTest(cSource, rustSource);
 * if (!result.passed()) {
 *     result.divergences().forEach(System.err::println);
 * }
 * }</pre>
 */
public final class DifferentialTester {

    private static final Logger LOG = Logger.getLogger(DifferentialTester.class.getName());

    private final DiffTestConfig config;

    /**
     * Creates a tester configured from {@code ~/.config/oxbow/difftest.json}, or defaults.
     */
    public DifferentialTester() {
        this(DiffTestConfigLoader.load());
    }

    public DifferentialTester(DiffTestConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public DiffTestConfig config() {
        return config;
    }

    /**
     * Compiles and runs both programs and compares their behavior.
     *
     * @param original   C source text
     * @param translated Rust source text
     * @return the comparison; a mismatch is reported here, not thrown
     * @throws CompilationException        if either compiler fails or cannot be started
     * @throws BinaryExecutionException    if either binary cannot be started
     * @throws ExecutionTimeoutException   if any compile or run exceeds the time limit
     * @throws DiffTestException           if scratch files cannot be written or the thread is interrupted
     */
    public DiffResult diffTest(String original, String translated) throws DiffTestException {
        Objects.requireNonNull(original, "original cannot be null");
        Objects.requireNonNull(translated, "translated cannot be null");

        try (ScratchDirectory originalDir = createScratch(Side.ORIGINAL);
             ScratchDirectory translatedDir = createScratch(Side.TRANSLATED)) {

            Path originalBinary = compile(Side.ORIGINAL, original, originalDir);
            Path translatedBinary = compile(Side.TRANSLATED, translated, translatedDir);

            ExecutionOutput originalOutput = execute(Side.ORIGINAL, originalBinary);
            ExecutionOutput translatedOutput = execute(Side.TRANSLATED, translatedBinary);

            DiffResult result = compare(originalOutput, translatedOutput, config.compareStderr());
            LOG.info(() -> result.passed()
                    ? "Differential test passed"
                    : String.format("Differential test failed with %d divergence(s)", result.divergences().size()));
            return result;
        }
    }

    /**
     * Writes the source for one side and compiles it.
     *
     * @return path of the produced binary
     */
    Path compile(Side side, String source, ScratchDirectory scratch) throws DiffTestException {
        Path sourceFile = scratch.resolve(side.sourceFileName());
        Path binary = scratch.resolve(side.binaryFileName());
        try {
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiffTestException(side, "Failed to write " + sourceFile + ": " + e.getMessage(), e);
        }

        String compiler = config.compilerFor(side);
        List<String> command = compileCommand(side, compiler, sourceFile, binary);
        ExecutionOutput output;
        try {
            output = ProcessRunner.run(command, scratch.path(), config.timeout());
        } catch (IOException e) {
            throw new CompilationException(side, compiler, "Failed to run " + compiler + ": " + e.getMessage(), e);
        } catch (OutputStillOpenException e) {
            throw new ExecutionTimeoutException(side, command, config.timeout(), e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ExecutionTimeoutException(side, command, config.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiffTestException(side, "Interrupted while compiling", e);
        }

        if (output.exitCode() != 0) {
            String diagnostics = output.stderr().isEmpty() ? output.stdout() : output.stderr();
            throw new CompilationException(side, compiler, diagnostics);
        }
        if (!Files.isRegularFile(binary)) {
            throw new CompilationException(side, compiler, "Compiler exited 0 but produced no binary at " + binary);
        }
        LOG.fine(() -> String.format("%s: compiled %s with %s", side.label(), sourceFile.getFileName(), compiler));
        return binary;
    }

    /**
     * Runs a compiled binary with no arguments.
     */
    ExecutionOutput execute(Side side, Path binary) throws DiffTestException {
        List<String> command = List.of(binary.toString());
        try {
            return ProcessRunner.run(command, binary.getParent(), config.timeout());
        } catch (IOException e) {
            throw new BinaryExecutionException(side, binary, e);
        } catch (OutputStillOpenException e) {
            throw new ExecutionTimeoutException(side, command, config.timeout(), e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ExecutionTimeoutException(side, command, config.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiffTestException(side, "Interrupted while running " + binary, e);
        }
    }

    /**
     * Compares two captured executions byte for byte.
     *
     * @param compareStderr whether a standard error difference is reported as a divergence
     */
    static DiffResult compare(ExecutionOutput original, ExecutionOutput translated, boolean compareStderr) {
        boolean stdoutMatches = original.sameStdout(translated);
        boolean exitCodeMatches = original.exitCode() == translated.exitCode();

        List<String> divergences = new ArrayList<>();
        if (!stdoutMatches) {
            divergences.add(String.format("stdout differs:\n  %s %s\n  %s %s",
                    labelColumn(Side.ORIGINAL), describe(original.stdoutBytes()),
                    labelColumn(Side.TRANSLATED), describe(translated.stdoutBytes())));
        }
        if (!exitCodeMatches) {
            divergences.add(String.format("exit code differs: %s=%d, %s=%d",
                    Side.ORIGINAL.label(), original.exitCode(), Side.TRANSLATED.label(), translated.exitCode()));
        }
        if (compareStderr && !original.sameStderr(translated)) {
            divergences.add(String.format("stderr differs:\n  %s %s\n  %s %s",
                    labelColumn(Side.ORIGINAL), describe(original.stderrBytes()),
                    labelColumn(Side.TRANSLATED), describe(translated.stderrBytes())));
        }
        return new DiffResult(original, translated, stdoutMatches, exitCodeMatches, divergences);
    }

    static List<String> compileCommand(Side side, String compiler, Path source, Path binary) {
        if (side == Side.ORIGINAL) {
            return List.of(compiler, "-o", binary.toString(), "-x", "c", "-std=c99", source.toString(), "-lm");
        }
        return List.of(compiler, "--edition=2021", "-o", binary.toString(), source.toString());
    }

    private ScratchDirectory createScratch(Side side) throws DiffTestException {
        try {
            return ScratchDirectory.create("oxbow-" + side.label().toLowerCase() + "-");
        } catch (IOException e) {
            throw new DiffTestException(side, "Failed to create scratch directory: " + e.getMessage(), e);
        }
    }

    /** "C:   " and "Rust:" so the two quoted values line up. */
    private static String labelColumn(Side side) {
        return String.format("%-5s", side.label() + ":");
    }

    /**
     * Quotes output for a divergence report: valid UTF-8 as text, anything else byte by
     * byte with non-printable bytes as {@code \xNN}.
     */
    static String describe(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        // UTF-8 never decodes to more chars than it has bytes
        CharBuffer text = CharBuffer.allocate(bytes.length);
        CoderResult result = decoder.decode(ByteBuffer.wrap(bytes), text, true);
        if (!result.isError()) {
            decoder.flush(text);
            return quote(text.flip().toString());
        }
        StringBuilder sb = new StringBuilder("\"");
        for (byte b : bytes) {
            int unsigned = b & 0xff;
            if (unsigned >= 0x20 && unsigned < 0x7f && unsigned != '"' && unsigned != '\\') {
                sb.append((char) unsigned);
            } else {
                sb.append(String.format("\\x%02x", unsigned));
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Quotes text with escapes for quotes, backslashes and control characters.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u{%x}", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
