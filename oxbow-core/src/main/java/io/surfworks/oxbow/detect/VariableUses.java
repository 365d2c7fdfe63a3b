package io.surfworks.oxbow.detect;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import io.surfworks.oxbow.ir.IrAst.Assign;
import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.DerefAssign;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.FieldAccess;
import io.surfworks.oxbow.ir.IrAst.For;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.If;
import io.surfworks.oxbow.ir.IrAst.Index;
import io.surfworks.oxbow.ir.IrAst.IndexAssign;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.LiteralKind;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;
import io.surfworks.oxbow.ir.IrAst.While;
import io.surfworks.oxbow.ir.IrWalker;

/**
 * Records how every variable of a function is used.
 *
 * <p>Each use is attributed to the top-level statement that contains it, so patterns
 * can ask questions such as "where is this pointer released" or "does it escape"
 * without walking the tree again.
 *
 * <p>Example:
 * <pre>{@code
 * VariableUses uses = VariableUses.build(function);
 *
 * // Index of the first top-level free(p) after the declaration
 * OptionalInt release = uses.releaseIndex("p", declIndex);
 *
 * // Whether p is copied, returned, passed along or address-taken
 * boolean escapes = uses.escapes("p");
 * }</pre>
 */
public final class VariableUses {

    /**
     * How a single occurrence of a variable is used.
     */
    public enum UseKind {
        READ,
        DEREFERENCE,
        /** {@code p[0]} */
        INDEX,
        /** {@code p[i]} with any index but the constant zero */
        OFFSET_INDEX,
        RELEASE,
        CALL_ARGUMENT,
        COPY,
        RETURNED,
        ADDRESS_TAKEN,
        REASSIGNED,
        /** {@code p++}, {@code --p} */
        STEPPED,
        /** destination of a {@code strcpy} statement */
        STRING_COPY_TARGET,
        /** operand of {@code strlen} or {@code puts}, or a {@code %s} argument of {@code printf} */
        STRING_READ
    }

    /**
     * One occurrence of a variable.
     *
     * @param statementIndex the enclosing top-level statement
     * @param kind           how the variable is used there
     */
    public record Use(int statementIndex, UseKind kind) {}

    // libc string functions read their arguments without retaining them
    private static final Set<UseKind> ESCAPING = EnumSet.of(
            UseKind.CALL_ARGUMENT, UseKind.COPY, UseKind.RETURNED, UseKind.ADDRESS_TAKEN);

    private final List<Stmt> body;
    private final Map<String, List<Use>> uses;
    private final Map<String, List<Expr>> assignedValues;
    private final Map<String, List<Expr>> copiedStrings;

    private VariableUses(List<Stmt> body, Scanner scanner) {
        this.body = body;
        this.uses = scanner.uses;
        this.assignedValues = scanner.assignedValues;
        this.copiedStrings = scanner.copiedStrings;
    }

    /**
     * Builds the use index for a function body.
     *
     * @param func the function to analyze
     * @return the use index
     */
    public static VariableUses build(Function func) {
        Scanner scanner = new Scanner();
        List<Stmt> body = func.body();
        for (int i = 0; i < body.size(); i++) {
            int index = i;
            IrWalker.forEachStmt(body.get(i), stmt -> scanner.scanStmt(stmt, index));
        }
        return new VariableUses(body, scanner);
    }

    private static final class Scanner {

        private final Map<String, List<Use>> uses = new HashMap<>();
        private final Map<String, List<Expr>> assignedValues = new HashMap<>();
        private final Map<String, List<Expr>> copiedStrings = new HashMap<>();

        void scanStmt(Stmt stmt, int index) {
            if (stmt instanceof VarDecl s) {
                s.initializer().ifPresent(init -> scanValue(init, index, UseKind.COPY));
            } else if (stmt instanceof Assign s) {
                addUse(s.target(), index, UseKind.REASSIGNED);
                assignedValues.computeIfAbsent(s.target(), k -> new ArrayList<>()).add(s.value());
                scanValue(s.value(), index, UseKind.COPY);
            } else if (stmt instanceof IndexAssign s) {
                scanIndexed(s.array(), s.index(), index);
                scanExpr(s.index(), index);
                scanValue(s.value(), index, UseKind.COPY);
            } else if (stmt instanceof DerefAssign s) {
                scanValue(s.pointer(), index, UseKind.DEREFERENCE);
                scanValue(s.value(), index, UseKind.COPY);
            } else if (stmt instanceof Return s) {
                s.value().ifPresent(v -> scanValue(v, index, UseKind.RETURNED));
            } else if (stmt instanceof ExprStmt s) {
                Optional<String> target = StringShapes.copyTarget(s.expr());
                if (target.isPresent()) {
                    Expr source = ((Call) s.expr()).args().get(1);
                    addUse(target.get(), index, UseKind.STRING_COPY_TARGET);
                    copiedStrings.computeIfAbsent(target.get(), k -> new ArrayList<>()).add(source);
                    scanValue(source, index, UseKind.CALL_ARGUMENT);
                } else {
                    scanExpr(s.expr(), index);
                }
            } else if (stmt instanceof If s) {
                scanExpr(s.condition(), index);
            } else if (stmt instanceof While s) {
                scanExpr(s.condition(), index);
            } else if (stmt instanceof For s) {
                scanExpr(s.condition(), index);
            }
        }

        /**
         * Scans an expression whose value flows somewhere; a bare variable there is
         * recorded with the given kind instead of {@link UseKind#READ}.
         */
        private void scanValue(Expr expr, int index, UseKind bareKind) {
            if (expr instanceof VarRef v) {
                addUse(v.name(), index, bareKind);
            } else {
                scanExpr(expr, index);
            }
        }

        private void scanExpr(Expr expr, int index) {
            if (expr instanceof VarRef v) {
                addUse(v.name(), index, UseKind.READ);
            } else if (expr instanceof Unary u) {
                if (u.op() == UnaryOp.DEREFERENCE) {
                    scanValue(u.operand(), index, UseKind.DEREFERENCE);
                } else if (u.op() == UnaryOp.ADDRESS_OF && u.operand() instanceof VarRef v) {
                    addUse(v.name(), index, UseKind.ADDRESS_TAKEN);
                } else if (u.op().isStep() && u.operand() instanceof VarRef v) {
                    addUse(v.name(), index, UseKind.STEPPED);
                } else {
                    scanExpr(u.operand(), index);
                }
            } else if (expr instanceof Binary b) {
                scanExpr(b.lhs(), index);
                scanExpr(b.rhs(), index);
            } else if (expr instanceof Call c) {
                scanCall(c, index);
            } else if (expr instanceof Index i) {
                scanIndexed(i.array(), i.index(), index);
                scanExpr(i.index(), index);
            } else if (expr instanceof FieldAccess f) {
                if (f.throughPointer()) {
                    scanValue(f.base(), index, UseKind.DEREFERENCE);
                } else {
                    scanExpr(f.base(), index);
                }
            }
        }

        private void scanCall(Call c, int index) {
            boolean release = c.calls(AllocationShapes.FREE);
            List<Integer> reads = StringShapes.stringArguments(c);
            for (int i = 0; i < c.args().size(); i++) {
                UseKind kind;
                if (release) {
                    kind = UseKind.RELEASE;
                } else if (reads.contains(i)) {
                    kind = UseKind.STRING_READ;
                } else {
                    kind = UseKind.CALL_ARGUMENT;
                }
                scanValue(c.args().get(i), index, kind);
            }
        }

        private void scanIndexed(Expr array, Expr position, int index) {
            boolean first = position instanceof Literal lit && lit.kind() == LiteralKind.INT && lit.text().equals("0");
            scanValue(array, index, first ? UseKind.INDEX : UseKind.OFFSET_INDEX);
        }

        private void addUse(String name, int index, UseKind kind) {
            uses.computeIfAbsent(name, k -> new ArrayList<>()).add(new Use(index, kind));
        }
    }

    /**
     * Returns every use of a variable in statement order.
     */
    public List<Use> uses(String variable) {
        return List.copyOf(uses.getOrDefault(variable, List.of()));
    }

    public int useCount(String variable) {
        return uses.getOrDefault(variable, List.of()).size();
    }

    /**
     * Returns true if the variable is used with the given kind anywhere in the function.
     */
    public boolean hasUse(String variable, UseKind kind) {
        return uses.getOrDefault(variable, List.of()).stream().anyMatch(u -> u.kind() == kind);
    }

    /**
     * Returns true if the pointer value can be observed outside its own variable.
     */
    public boolean escapes(String variable) {
        return uses.getOrDefault(variable, List.of()).stream().anyMatch(u -> ESCAPING.contains(u.kind()));
    }

    /**
     * Returns the values assigned to the variable by {@code variable = value;} statements,
     * at any depth, in statement order.
     */
    public List<Expr> assignedValues(String variable) {
        return List.copyOf(assignedValues.getOrDefault(variable, List.of()));
    }

    /**
     * Returns the sources of the {@code strcpy(variable, source);} statements that fill the variable.
     */
    public List<Expr> copiedStrings(String variable) {
        return List.copyOf(copiedStrings.getOrDefault(variable, List.of()));
    }

    /**
     * Finds the first top-level {@code free(variable);} statement after {@code declIndex}.
     *
     * @param variable  the pointer variable
     * @param declIndex index of its declaration
     * @return the release statement index, or empty if it is never released at top level
     */
    public OptionalInt releaseIndex(String variable, int declIndex) {
        for (int i = declIndex + 1; i < body.size(); i++) {
            if (AllocationShapes.isRelease(body.get(i), variable)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return String.format("VariableUses[variables=%d]", uses.size());
    }
}
