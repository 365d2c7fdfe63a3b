package io.surfworks.oxbow.detect;

import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * Matches {@code T *p = NULL}.
 */
public final class NullablePointerPattern implements IdiomPattern {

    @Override
    public IdiomFamily family() {
        return IdiomFamily.NULLABLE_POINTER;
    }

    @Override
    public Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses) {
        if (!IdiomPattern.declaresTypedPointer(decl)) {
            return Optional.empty();
        }
        boolean isNull = decl.initializer()
                .map(AllocationShapes::isNullLiteral)
                .orElse(false);
        if (!isNull) {
            return Optional.empty();
        }
        return Optional.of(RewriteCandidate.of(decl.name(), index, family()));
    }
}
