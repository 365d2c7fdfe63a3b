package io.surfworks.oxbow.detect;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.oxbow.detect.VariableUses.Use;
import io.surfworks.oxbow.detect.VariableUses.UseKind;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.VarDecl;

/**
 * Matches an uninitialized {@code char buf[N]} that is filled only by
 * {@code strcpy(buf, "literal");} and otherwise only read as a C string.
 *
 * <p>The first use must be a copy, and every copied literal must fit the buffer
 * with its terminator.
 */
public final class StringCopyPattern implements IdiomPattern {

    private static final Set<UseKind> ALLOWED = EnumSet.of(UseKind.STRING_COPY_TARGET, UseKind.STRING_READ);

    @Override
    public IdiomFamily family() {
        return IdiomFamily.STRING_COPY;
    }

    @Override
    public Optional<RewriteCandidate> match(int index, VarDecl decl, VariableUses uses) {
        if (!declaresCharBuffer(decl)) {
            return Optional.empty();
        }
        List<Use> all = uses.uses(decl.name());
        if (all.isEmpty() || all.get(0).kind() != UseKind.STRING_COPY_TARGET) {
            return Optional.empty();
        }
        if (!all.stream().allMatch(u -> ALLOWED.contains(u.kind()) && u.statementIndex() > index)) {
            return Optional.empty();
        }
        int capacity = StringShapes.bufferLength(decl.type()).orElseThrow();
        for (Expr source : uses.copiedStrings(decl.name())) {
            if (!StringShapes.fitsLiteral(source, capacity)) {
                return Optional.empty();
            }
        }
        return Optional.of(RewriteCandidate.of(decl.name(), index, family()));
    }

    @Override
    public double priority() {
        return 4.0;
    }

    /**
     * True for an uninitialized declaration of a sized char array.
     */
    public static boolean declaresCharBuffer(VarDecl decl) {
        return decl.initializer().isEmpty() && StringShapes.bufferLength(decl.type()).isPresent();
    }
}
