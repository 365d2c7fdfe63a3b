package io.surfworks.oxbow.ir;

import java.util.List;
import java.util.function.Consumer;

import io.surfworks.oxbow.ir.IrAst.Assign;
import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.Break;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Continue;
import io.surfworks.oxbow.ir.IrAst.DerefAssign;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.FieldAccess;
import io.surfworks.oxbow.ir.IrAst.For;
import io.surfworks.oxbow.ir.IrAst.If;
import io.surfworks.oxbow.ir.IrAst.Index;
import io.surfworks.oxbow.ir.IrAst.IndexAssign;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.SizeOf;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;
import io.surfworks.oxbow.ir.IrAst.While;

/**
 * Pre-order traversal helpers over the IR tree.
 */
public final class IrWalker {

    private IrWalker() {}

    /**
     * Visits every statement in the list, recursing into nested bodies.
     * The consumer sees a parent statement before its children.
     */
    public static void forEachStmt(List<Stmt> body, Consumer<Stmt> visitor) {
        for (Stmt stmt : body) {
            forEachStmt(stmt, visitor);
        }
    }

    public static void forEachStmt(Stmt stmt, Consumer<Stmt> visitor) {
        visitor.accept(stmt);
        if (stmt instanceof If s) {
            forEachStmt(s.thenBody(), visitor);
            forEachStmt(s.elseBody(), visitor);
        } else if (stmt instanceof While s) {
            forEachStmt(s.body(), visitor);
        } else if (stmt instanceof For s) {
            s.init().ifPresent(init -> forEachStmt(init, visitor));
            forEachStmt(s.body(), visitor);
            s.increment().ifPresent(inc -> forEachStmt(inc, visitor));
        }
    }

    /**
     * Visits every expression directly owned by a statement (not those of nested statements),
     * including all sub-expressions.
     */
    public static void forEachExpr(Stmt stmt, Consumer<Expr> visitor) {
        if (stmt instanceof VarDecl s) {
            s.initializer().ifPresent(e -> forEachExpr(e, visitor));
        } else if (stmt instanceof Assign s) {
            forEachExpr(new VarRef(s.target()), visitor);
            forEachExpr(s.value(), visitor);
        } else if (stmt instanceof IndexAssign s) {
            forEachExpr(s.array(), visitor);
            forEachExpr(s.index(), visitor);
            forEachExpr(s.value(), visitor);
        } else if (stmt instanceof DerefAssign s) {
            forEachExpr(s.pointer(), visitor);
            forEachExpr(s.value(), visitor);
        } else if (stmt instanceof If s) {
            forEachExpr(s.condition(), visitor);
        } else if (stmt instanceof While s) {
            forEachExpr(s.condition(), visitor);
        } else if (stmt instanceof For s) {
            forEachExpr(s.condition(), visitor);
        } else if (stmt instanceof Return s) {
            s.value().ifPresent(e -> forEachExpr(e, visitor));
        } else if (stmt instanceof ExprStmt s) {
            forEachExpr(s.expr(), visitor);
        } else if (!(stmt instanceof Break) && !(stmt instanceof Continue)) {
            throw new IllegalStateException("Unhandled statement: " + stmt);
        }
    }

    public static void forEachExpr(Expr expr, Consumer<Expr> visitor) {
        visitor.accept(expr);
        if (expr instanceof Unary e) {
            forEachExpr(e.operand(), visitor);
        } else if (expr instanceof Binary e) {
            forEachExpr(e.lhs(), visitor);
            forEachExpr(e.rhs(), visitor);
        } else if (expr instanceof Call e) {
            for (Expr arg : e.args()) {
                forEachExpr(arg, visitor);
            }
        } else if (expr instanceof Index e) {
            forEachExpr(e.array(), visitor);
            forEachExpr(e.index(), visitor);
        } else if (expr instanceof FieldAccess e) {
            forEachExpr(e.base(), visitor);
        } else if (!(expr instanceof Literal) && !(expr instanceof VarRef) && !(expr instanceof SizeOf)) {
            throw new IllegalStateException("Unhandled expression: " + expr);
        }
    }

    /**
     * Returns true if the expression is a plain reference to the named variable.
     */
    public static boolean isVar(Expr expr, String name) {
        return expr instanceof VarRef v && v.name().equals(name);
    }
}
