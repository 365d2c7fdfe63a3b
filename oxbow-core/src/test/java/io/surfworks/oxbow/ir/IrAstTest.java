package io.surfworks.oxbow.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.Assign;
import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.BinaryOp;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.For;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.If;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.Param;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;

/**
 * Tests for the IR model and its traversal helpers.
 */
@DisplayName("IR Model")
class IrAstTest {

    // ==================== Types ====================

    @Nested
    @DisplayName("Types")
    class TypeTests {

        @Test
        @DisplayName("renders C spellings")
        void rendersCSpellings() {
            assertEquals("int", ScalarType.INT.toCString());
            assertEquals("char*", new PointerType(ScalarType.CHAR).toCString());
            assertEquals("float[4]", ArrayType.sized(ScalarType.FLOAT, 4).toCString());
            assertEquals("int[]", ArrayType.unsized(ScalarType.INT).toCString());
        }

        @Test
        @DisplayName("looks up scalar types by name")
        void looksUpScalarTypes() {
            assertEquals(ScalarType.CHAR, ScalarType.of("char"));
            assertThrows(IllegalArgumentException.class, () -> ScalarType.of("double"));
        }

        @Test
        @DisplayName("distinguishes void and pointer types")
        void distinguishesVoidAndPointers() {
            assertTrue(ScalarType.VOID.isVoid());
            assertFalse(ScalarType.INT.isVoid());
            assertTrue(new PointerType(ScalarType.VOID).isPointer());
            assertFalse(new PointerType(ScalarType.VOID).isVoid());
        }

        @Test
        @DisplayName("rejects negative array length")
        void rejectsNegativeArrayLength() {
            assertThrows(IllegalArgumentException.class, () -> ArrayType.sized(ScalarType.INT, -1));
        }
    }

    // ==================== Nodes ====================

    @Nested
    @DisplayName("Nodes")
    class NodeTests {

        @Test
        @DisplayName("rejects blank names")
        void rejectsBlankNames() {
            assertThrows(IllegalArgumentException.class, () -> new VarRef(" "));
            assertThrows(IllegalArgumentException.class,
                    () -> new Function("", ScalarType.INT, List.of(), List.of()));
            assertThrows(NullPointerException.class, () -> new Param(null, ScalarType.INT));
        }

        @Test
        @DisplayName("copies list components")
        void copiesListComponents() {
            List<Stmt> body = new ArrayList<>();
            body.add(Return.of(Literal.ofInt(0)));
            Function func = new Function("f", ScalarType.INT, List.of(), body);

            body.add(Return.of(Literal.ofInt(1)));

            assertEquals(1, func.body().size());
            assertThrows(UnsupportedOperationException.class, () -> func.body().add(new IrAst.Break()));
        }

        @Test
        @DisplayName("classifies unary operators")
        void classifiesUnaryOperators() {
            assertTrue(UnaryOp.POST_INCREMENT.isStep());
            assertFalse(UnaryOp.POST_INCREMENT.isPrefix());
            assertTrue(UnaryOp.PRE_DECREMENT.isPrefix());
            assertFalse(UnaryOp.PRE_DECREMENT.isIncrement());
            assertFalse(UnaryOp.DEREFERENCE.isStep());
        }

        @Test
        @DisplayName("orders binary operators by C precedence")
        void ordersBinaryOperators() {
            assertTrue(BinaryOp.MUL.precedence() > BinaryOp.ADD.precedence());
            assertTrue(BinaryOp.ADD.precedence() > BinaryOp.LT.precedence());
            assertTrue(BinaryOp.EQ.isComparison());
            assertTrue(BinaryOp.LOGICAL_OR.isLogical());
            assertFalse(BinaryOp.BIT_AND.isComparison());
        }
    }

    // ==================== Walker ====================

    @Nested
    @DisplayName("IrWalker")
    class WalkerTests {

        @Test
        @DisplayName("visits nested statements in pre-order")
        void visitsNestedStatements() {
            Stmt inner = new ExprStmt(Call.of("printf", Literal.ofString("x")));
            Stmt loop = new For(
                    Optional.of(VarDecl.of("i", ScalarType.INT, Literal.ofInt(0))),
                    new Binary(BinaryOp.LT, new VarRef("i"), Literal.ofInt(3)),
                    Optional.of(new ExprStmt(new Unary(UnaryOp.POST_INCREMENT, new VarRef("i")))),
                    List.of(If.of(new VarRef("i"), List.of(inner))));

            List<Stmt> seen = new ArrayList<>();
            IrWalker.forEachStmt(loop, seen::add);

            assertEquals(5, seen.size());
            assertEquals(loop, seen.get(0));
            assertTrue(seen.contains(inner));
        }

        @Test
        @DisplayName("visits sub-expressions of a statement")
        void visitsSubExpressions() {
            Stmt assign = new Assign("x",
                    new Binary(BinaryOp.ADD, new VarRef("a"), Call.of("f", new VarRef("b"))));

            List<Expr> seen = new ArrayList<>();
            IrWalker.forEachExpr(assign, seen::add);

            long vars = seen.stream().filter(e -> e instanceof VarRef).count();
            assertEquals(3, vars);
            assertTrue(IrWalker.isVar(new VarRef("x"), "x"));
            assertFalse(IrWalker.isVar(Literal.ofInt(1), "x"));
        }
    }
}
