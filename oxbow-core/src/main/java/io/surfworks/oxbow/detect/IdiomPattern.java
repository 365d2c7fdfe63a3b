package io.surfworks.oxbow.detect;

import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * A structural matcher for one family of unsafe idioms.
 *
 * <p>Patterns are applied by {@link PatternDetector}, which offers every top-level
 * declaration of a function to each pattern in priority order. The first pattern
 * that matches claims the declaration.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class NullablePointerPattern implements IdiomPattern {
 *     @Override
 *     public IdiomFamily family() { return IdiomFamily.NULLABLE_POINTER; }
 *
 *     @Override
 *     public Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses) {
 *         if (!AllocationShapes.isNullLiteral(decl.initializer().orElse(null))) return Optional.empty();
 *         return Optional.of(RewriteCandidate.of(decl.name(), index, family()));
 *     }
 * }
 * }</pre>
 */
public interface IdiomPattern {

    /**
     * Returns the idiom family this pattern recognizes.
     */
    IdiomFamily family();

    /**
     * Attempts to match a top-level declaration.
     *
     * @param index the declaration's position in the function's top-level body
     * @param decl  the declaration
     * @param uses  variable use index for the whole function
     * @return a candidate if the declaration is an instance of the idiom, empty otherwise
     */
    Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses);

    /**
     * Returns the priority of this pattern. Higher priority patterns are tried first,
     * so more specific shapes should score higher than the general ones they overlap.
     *
     * @return the priority (default 1.0)
     */
    default double priority() {
        return 1.0;
    }

    /**
     * Returns a human-readable name, used in logging.
     */
    default String name() {
        return family().name().toLowerCase();
    }

    /**
     * True when the declaration is a pointer to a non-void type, the precondition for
     * every ownership upgrade.
     */
    static boolean declaresTypedPointer(VarDecl decl) {
        return decl.type() instanceof PointerType ptr && !ptr.pointee().isVoid();
    }
}
