package io.surfworks.oxbow.verify;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a differential test. A mismatch is a normal result, not an error.
 *
 * @param originalOutput   what the compiled C program produced
 * @param translatedOutput what the compiled Rust program produced
 * @param stdoutMatches    whether standard output is identical
 * @param exitCodeMatches  whether exit codes are identical
 * @param divergences      one human-readable entry per observed difference
 */
public record DiffResult(
        ExecutionOutput originalOutput,
        ExecutionOutput translatedOutput,
        boolean stdoutMatches,
        boolean exitCodeMatches,
        List<String> divergences
) {

    public DiffResult {
        Objects.requireNonNull(originalOutput, "originalOutput cannot be null");
        Objects.requireNonNull(translatedOutput, "translatedOutput cannot be null");
        divergences = List.copyOf(divergences);
    }

    /**
     * True when standard output and exit code both match. Standard error never affects
     * this, even when it is compared and reported as a divergence.
     */
    public boolean passed() {
        return stdoutMatches && exitCodeMatches;
    }
}
