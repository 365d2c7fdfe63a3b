package io.surfworks.oxbow.verify;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Captured result of running one binary.
 *
 * <p>Output is kept as the exact bytes the process wrote. Comparisons use the bytes;
 * {@link #stdout()} and {@link #stderr()} decode them as UTF-8 with malformed input
 * replaced, for display only.
 *
 * @param stdoutBytes standard output
 * @param stderrBytes standard error
 * @param exitCode    exit status; a process killed by signal N reports 128 + N
 */
public record ExecutionOutput(byte[] stdoutBytes, byte[] stderrBytes, int exitCode) {

    public ExecutionOutput {
        stdoutBytes = Objects.requireNonNull(stdoutBytes, "stdoutBytes cannot be null").clone();
        stderrBytes = Objects.requireNonNull(stderrBytes, "stderrBytes cannot be null").clone();
    }

    /**
     * Creates an output from text, encoded as UTF-8.
     */
    public ExecutionOutput(String stdout, String stderr, int exitCode) {
        this(Objects.requireNonNull(stdout, "stdout cannot be null").getBytes(StandardCharsets.UTF_8),
                Objects.requireNonNull(stderr, "stderr cannot be null").getBytes(StandardCharsets.UTF_8),
                exitCode);
    }

    @Override
    public byte[] stdoutBytes() {
        return stdoutBytes.clone();
    }

    @Override
    public byte[] stderrBytes() {
        return stderrBytes.clone();
    }

    public String stdout() {
        return new String(stdoutBytes, StandardCharsets.UTF_8);
    }

    public String stderr() {
        return new String(stderrBytes, StandardCharsets.UTF_8);
    }

    public boolean sameStdout(ExecutionOutput other) {
        return Arrays.equals(stdoutBytes, other.stdoutBytes);
    }

    public boolean sameStderr(ExecutionOutput other) {
        return Arrays.equals(stderrBytes, other.stderrBytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExecutionOutput other
                && exitCode == other.exitCode
                && sameStdout(other)
                && sameStderr(other);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(stdoutBytes) + Arrays.hashCode(stderrBytes)) + exitCode;
    }

    @Override
    public String toString() {
        return String.format("ExecutionOutput[stdout=%d bytes, stderr=%d bytes, exitCode=%d]",
                stdoutBytes.length, stderrBytes.length, exitCode);
    }
}
