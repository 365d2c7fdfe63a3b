package io.surfworks.oxbow.detect;

import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.BinaryOp;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.SizeOf;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrWalker;

/**
 * Structural recognizers for calls into the C allocator.
 */
public final class AllocationShapes {

    public static final String MALLOC = "malloc";
    public static final String CALLOC = "calloc";
    public static final String FREE = "free";

    private AllocationShapes() {}

    /**
     * True for {@code malloc(size)} and {@code calloc(n, size)}.
     */
    public static boolean isAllocation(Expr expr) {
        if (!(expr instanceof Call call)) {
            return false;
        }
        return (call.calls(MALLOC) && call.args().size() == 1)
                || (call.calls(CALLOC) && call.args().size() == 2);
    }

    /**
     * Returns the element count of an array allocation.
     *
     * <p>Recognized shapes: {@code calloc(n, size)}, {@code malloc(n * sizeof(T))} and
     * {@code malloc(sizeof(T) * n)}. A plain {@code malloc(size)} is a single-object
     * allocation and yields empty.
     */
    public static Optional<Expr> elementCount(Expr expr) {
        if (!isAllocation(expr)) {
            return Optional.empty();
        }
        Call call = (Call) expr;
        if (call.calls(CALLOC)) {
            return Optional.of(call.args().get(0));
        }
        Expr size = call.args().get(0);
        if (size instanceof Binary product && product.op() == BinaryOp.MUL) {
            if (product.rhs() instanceof SizeOf) {
                return Optional.of(product.lhs());
            }
            if (product.lhs() instanceof SizeOf) {
                return Optional.of(product.rhs());
            }
        }
        return Optional.empty();
    }

    public static boolean isArrayAllocation(Expr expr) {
        return elementCount(expr).isPresent();
    }

    public static boolean isNullLiteral(Expr expr) {
        return expr instanceof Literal lit && lit.isNull();
    }

    /**
     * True for the statement {@code free(variable);}.
     */
    public static boolean isRelease(Stmt stmt, String variable) {
        return stmt instanceof ExprStmt es
                && es.expr() instanceof Call call
                && call.calls(FREE)
                && call.args().size() == 1
                && IrWalker.isVar(call.args().get(0), variable);
    }
}
