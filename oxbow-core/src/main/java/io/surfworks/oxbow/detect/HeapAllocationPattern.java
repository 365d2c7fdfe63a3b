package io.surfworks.oxbow.detect;

import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * Matches {@code T *p = malloc(size)} allocating a single object.
 */
public final class HeapAllocationPattern implements IdiomPattern {

    @Override
    public IdiomFamily family() {
        return IdiomFamily.HEAP_ALLOCATION;
    }

    @Override
    public Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses) {
        if (!IdiomPattern.declaresTypedPointer(decl) || decl.initializer().isEmpty()) {
            return Optional.empty();
        }
        Expr init = decl.initializer().get();
        if (!AllocationShapes.isAllocation(init) || AllocationShapes.isArrayAllocation(init)) {
            return Optional.empty();
        }
        return Optional.of(new RewriteCandidate(
                decl.name(), index, family(), uses.releaseIndex(decl.name(), index)));
    }

    @Override
    public double priority() {
        return 2.0;
    }
}
