package io.surfworks.oxbow.detect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.oxbow.detect.VariableUses.UseKind;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * Finds unsafe C idioms in a function that have a safe Rust replacement.
 *
 * <p>The detector walks the function's top-level statements and offers each
 * declaration to the registered patterns in priority order (highest first).
 * The first pattern that matches claims the declaration; at most one candidate
 * is produced per statement. Nested statements are not scanned.
 *
 * <p>Matching is structural. A match is dropped under every policy when another use of
 * the variable cannot be expressed through the owning form: stepping it, taking its
 * address, indexing a single object past zero, or assigning it a value the form cannot
 * hold. Whether aliasing is checked as well is controlled by the {@link AliasPolicy}.
 *
 * <p>Instances are immutable and can be shared across threads.
 *
 * <p>Example usage:
 * <pre>{@code
 * PatternDetector detector = PatternDetector.withStandardPatterns()
 *     .withAliasPolicy(AliasPolicy.CONSERVATIVE);
 *
 * List<RewriteCandidate> candidates = detector.detect(function);
 * String rust = generator.generateUpgraded(function, candidates);
 * }</pre>
 */
public final class PatternDetector {

    private static final Logger LOG = Logger.getLogger(PatternDetector.class.getName());

    private final List<IdiomPattern> patterns;
    private final AliasPolicy aliasPolicy;

    /**
     * Creates a detector with the standard patterns and the structural alias policy.
     */
    public PatternDetector() {
        this(standardPatterns(), AliasPolicy.STRUCTURAL);
    }

    /**
     * Creates a detector with the given patterns.
     *
     * @param patterns    the patterns to apply
     * @param aliasPolicy how to treat candidates whose pointer escapes
     */
    public PatternDetector(List<IdiomPattern> patterns, AliasPolicy aliasPolicy) {
        List<IdiomPattern> sorted = new ArrayList<>(patterns);
        sorted.sort(Comparator.comparingDouble(IdiomPattern::priority).reversed());
        this.patterns = List.copyOf(sorted);
        this.aliasPolicy = Objects.requireNonNull(aliasPolicy, "aliasPolicy cannot be null");
    }

    /**
     * Creates a detector for string copy, heap allocation, array allocation and nullable
     * pointer idioms.
     *
     * @return a detector with standard patterns
     */
    public static PatternDetector withStandardPatterns() {
        return new PatternDetector();
    }

    private static List<IdiomPattern> standardPatterns() {
        return List.of(
                new StringCopyPattern(),
                new ArrayAllocationPattern(),
                new HeapAllocationPattern(),
                new NullablePointerPattern());
    }

    /**
     * Returns a detector with the same patterns and a different alias policy.
     */
    public PatternDetector withAliasPolicy(AliasPolicy policy) {
        return new PatternDetector(patterns, policy);
    }

    /**
     * Detects rewrite candidates in a function.
     *
     * @param func the function to scan
     * @return candidates in statement order; empty if nothing matches
     */
    public List<RewriteCandidate> detect(Function func) {
        if (patterns.isEmpty()) {
            return List.of();
        }

        VariableUses uses = VariableUses.build(func);
        List<RewriteCandidate> candidates = new ArrayList<>();
        List<Stmt> body = func.body();

        for (int i = 0; i < body.size(); i++) {
            if (!(body.get(i) instanceof VarDecl decl)) {
                continue;
            }
            Optional<RewriteCandidate> match = tryPatterns(i, decl, uses);
            if (match.isEmpty()) {
                continue;
            }
            Optional<String> conflict = ownershipConflict(match.get(), uses);
            if (conflict.isPresent()) {
                LOG.fine(() -> String.format("%s: rejected %s, %s", func.name(), match.get(), conflict.get()));
                continue;
            }
            if (aliasPolicy == AliasPolicy.CONSERVATIVE && uses.escapes(decl.name())) {
                LOG.fine(() -> String.format("%s: rejected %s, pointer escapes", func.name(), match.get()));
                continue;
            }
            LOG.fine(() -> String.format("%s: %s becomes %s",
                    func.name(), match.get(), match.get().family().safeForm()));
            candidates.add(match.get());
        }

        LOG.fine(() -> String.format("%s: %d rewrite candidate(s)", func.name(), candidates.size()));
        return List.copyOf(candidates);
    }

    private Optional<RewriteCandidate> tryPatterns(int index, VarDecl decl, VariableUses uses) {
        for (IdiomPattern pattern : patterns) {
            Optional<RewriteCandidate> match = pattern.match(index, decl, uses);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns why the owning form cannot express some use of the candidate's variable.
     */
    private static Optional<String> ownershipConflict(RewriteCandidate candidate, VariableUses uses) {
        String variable = candidate.variable();
        IdiomFamily family = candidate.family();
        if (uses.hasUse(variable, UseKind.STEPPED)) {
            return Optional.of("pointer is stepped");
        }
        if (uses.hasUse(variable, UseKind.ADDRESS_TAKEN)) {
            return Optional.of("address is taken");
        }
        boolean singleObject = family == IdiomFamily.HEAP_ALLOCATION || family == IdiomFamily.NULLABLE_POINTER;
        if (singleObject && uses.hasUse(variable, UseKind.OFFSET_INDEX)) {
            return Optional.of("indexed past its single object");
        }
        for (Expr value : uses.assignedValues(variable)) {
            if (!family.canHold(value)) {
                return Optional.of("reassigned to " + value);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the registered patterns in priority order.
     */
    public List<IdiomPattern> patterns() {
        return patterns;
    }

    public AliasPolicy aliasPolicy() {
        return aliasPolicy;
    }

    @Override
    public String toString() {
        return String.format("PatternDetector[patterns=%d, aliasPolicy=%s]", patterns.size(), aliasPolicy);
    }
}
