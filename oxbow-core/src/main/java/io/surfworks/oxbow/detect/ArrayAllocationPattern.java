package io.surfworks.oxbow.detect;

import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * Matches {@code T *p = malloc(n * sizeof(T))} and {@code T *p = calloc(n, size)}.
 *
 * <p>Checked before {@link HeapAllocationPattern}, whose shape it refines.
 */
public final class ArrayAllocationPattern implements IdiomPattern {

    @Override
    public IdiomFamily family() {
        return IdiomFamily.ARRAY_ALLOCATION;
    }

    @Override
    public Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses) {
        if (!IdiomPattern.declaresTypedPointer(decl)) {
            return Optional.empty();
        }
        boolean matches = decl.initializer()
                .map(AllocationShapes::isArrayAllocation)
                .orElse(false);
        if (!matches) {
            return Optional.empty();
        }
        return Optional.of(new RewriteCandidate(
                decl.name(), index, family(), uses.releaseIndex(decl.name(), index)));
    }

    @Override
    public double priority() {
        return 3.0;
    }
}
