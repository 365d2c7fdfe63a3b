package io.surfworks.oxbow.detect;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A location in a function where an unsafe idiom can be replaced by a safe one.
 *
 * <p>Candidates are produced fresh by {@link PatternDetector#detect} and consumed
 * immediately by the code generator; they are never persisted.
 *
 * @param variable       the declared variable
 * @param statementIndex index of the declaring statement in the function's top-level body
 * @param family         the idiom that matched
 * @param releaseIndex   index of the top-level {@code free(variable);} that releases it, if any
 */
public record RewriteCandidate(
        String variable,
        int statementIndex,
        IdiomFamily family,
        OptionalInt releaseIndex
) {

    public RewriteCandidate {
        Objects.requireNonNull(variable, "variable cannot be null");
        Objects.requireNonNull(family, "family cannot be null");
        Objects.requireNonNull(releaseIndex, "releaseIndex cannot be null");
        if (statementIndex < 0) {
            throw new IllegalArgumentException("statementIndex cannot be negative: " + statementIndex);
        }
        if (releaseIndex.isPresent() && !family.allocates()) {
            throw new IllegalArgumentException(family + " does not allocate, so it has no release");
        }
    }

    public static RewriteCandidate of(String variable, int statementIndex, IdiomFamily family) {
        return new RewriteCandidate(variable, statementIndex, family, OptionalInt.empty());
    }

    public boolean hasRelease() {
        return releaseIndex.isPresent();
    }

    @Override
    public String toString() {
        String release = releaseIndex.isPresent() ? ", free@" + releaseIndex.getAsInt() : "";
        return String.format("RewriteCandidate[%s %s@%d%s]", family, variable, statementIndex, release);
    }
}
