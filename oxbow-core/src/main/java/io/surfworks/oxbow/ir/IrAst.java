package io.surfworks.oxbow.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Typed tree model of C functions, independent of concrete syntax.
 *
 * These classes are produced by the C front end and consumed by the
 * pattern detector and the Rust code generator. Every node is immutable
 * once built; list components are copied on construction.
 */
public final class IrAst {

    private IrAst() {}

    // ==================== Types ====================

    /**
     * Base interface for all C types.
     */
    public sealed interface Type permits ScalarType, PointerType, ArrayType {
        String toCString();

        default boolean isPointer() {
            return this instanceof PointerType;
        }

        default boolean isVoid() {
            return this instanceof ScalarType s && s.kind() == Scalar.VOID;
        }
    }

    /**
     * Scalar types: void, int, char, float.
     */
    public record ScalarType(Scalar kind) implements Type {
        public static final ScalarType VOID = new ScalarType(Scalar.VOID);
        public static final ScalarType INT = new ScalarType(Scalar.INT);
        public static final ScalarType CHAR = new ScalarType(Scalar.CHAR);
        public static final ScalarType FLOAT = new ScalarType(Scalar.FLOAT);

        public ScalarType {
            Objects.requireNonNull(kind, "kind cannot be null");
        }

        public static ScalarType of(String name) {
            return switch (name) {
                case "void" -> VOID;
                case "int" -> INT;
                case "char" -> CHAR;
                case "float" -> FLOAT;
                default -> throw new IllegalArgumentException("Unknown scalar type: " + name);
            };
        }

        @Override
        public String toCString() {
            return kind.name().toLowerCase();
        }
    }

    public enum Scalar {
        VOID, INT, CHAR, FLOAT
    }

    /**
     * Pointer type: int*, char**, void*
     */
    public record PointerType(Type pointee) implements Type {
        public PointerType {
            Objects.requireNonNull(pointee, "pointee cannot be null");
        }

        @Override
        public String toCString() {
            return pointee.toCString() + "*";
        }
    }

    /**
     * Array type with an optional compile-time length: int[10], char[]
     */
    public record ArrayType(Type element, OptionalInt length) implements Type {
        public ArrayType {
            Objects.requireNonNull(element, "element cannot be null");
            Objects.requireNonNull(length, "length cannot be null");
            if (length.isPresent() && length.getAsInt() < 0) {
                throw new IllegalArgumentException("Array length cannot be negative: " + length.getAsInt());
            }
        }

        public static ArrayType sized(Type element, int length) {
            return new ArrayType(element, OptionalInt.of(length));
        }

        public static ArrayType unsized(Type element) {
            return new ArrayType(element, OptionalInt.empty());
        }

        @Override
        public String toCString() {
            String dim = length.isPresent() ? String.valueOf(length.getAsInt()) : "";
            return element.toCString() + "[" + dim + "]";
        }
    }

    // ==================== Expressions ====================

    /**
     * Base interface for all expressions.
     */
    public sealed interface Expr permits Literal, VarRef, Unary, Binary, Call, Index, FieldAccess, SizeOf {
    }

    public enum LiteralKind {
        INT, FLOAT, CHAR, STRING, NULL
    }

    /**
     * Literal constant. STRING and CHAR text holds the decoded characters, not the C escape spelling.
     */
    public record Literal(LiteralKind kind, String text) implements Expr {
        public Literal {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(text, "text cannot be null");
        }

        public static Literal ofInt(long value) {
            return new Literal(LiteralKind.INT, Long.toString(value));
        }

        public static Literal ofFloat(String text) {
            return new Literal(LiteralKind.FLOAT, text);
        }

        public static Literal ofChar(char c) {
            return new Literal(LiteralKind.CHAR, String.valueOf(c));
        }

        public static Literal ofString(String text) {
            return new Literal(LiteralKind.STRING, text);
        }

        public static Literal nul() {
            return new Literal(LiteralKind.NULL, "NULL");
        }

        public boolean isNull() {
            return kind == LiteralKind.NULL;
        }
    }

    /**
     * Reference to a local variable or parameter.
     */
    public record VarRef(String name) implements Expr {
        public VarRef {
            requireName(name);
        }
    }

    public enum UnaryOp {
        PRE_INCREMENT("++", true),
        PRE_DECREMENT("--", true),
        POST_INCREMENT("++", false),
        POST_DECREMENT("--", false),
        NEGATE("-", true),
        LOGICAL_NOT("!", true),
        BITWISE_NOT("~", true),
        DEREFERENCE("*", true),
        ADDRESS_OF("&", true);

        private final String symbol;
        private final boolean prefix;

        UnaryOp(String symbol, boolean prefix) {
            this.symbol = symbol;
            this.prefix = prefix;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPrefix() {
            return prefix;
        }

        /** True for the four operators that mutate their operand. */
        public boolean isStep() {
            return this == PRE_INCREMENT || this == PRE_DECREMENT
                    || this == POST_INCREMENT || this == POST_DECREMENT;
        }

        public boolean isIncrement() {
            return this == PRE_INCREMENT || this == POST_INCREMENT;
        }
    }

    public record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(operand, "operand cannot be null");
        }
    }

    /**
     * Binary operators with their C precedence (higher binds tighter).
     */
    public enum BinaryOp {
        MUL("*", 10), DIV("/", 10), MOD("%", 10),
        ADD("+", 9), SUB("-", 9),
        SHL("<<", 8), SHR(">>", 8),
        LT("<", 7), LE("<=", 7), GT(">", 7), GE(">=", 7),
        EQ("==", 6), NE("!=", 6),
        BIT_AND("&", 5),
        BIT_XOR("^", 4),
        BIT_OR("|", 3),
        LOGICAL_AND("&&", 2),
        LOGICAL_OR("||", 1);

        private final String symbol;
        private final int precedence;

        BinaryOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isComparison() {
            return precedence == 7 || precedence == 6;
        }

        public boolean isLogical() {
            return this == LOGICAL_AND || this == LOGICAL_OR;
        }
    }

    public record Binary(BinaryOp op, Expr lhs, Expr rhs) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(lhs, "lhs cannot be null");
            Objects.requireNonNull(rhs, "rhs cannot be null");
        }
    }

    public record Call(String function, List<Expr> args) implements Expr {
        public Call {
            requireName(function);
            args = List.copyOf(args);
        }

        public static Call of(String function, Expr... args) {
            return new Call(function, List.of(args));
        }

        public boolean calls(String name) {
            return function.equals(name);
        }
    }

    public record Index(Expr array, Expr index) implements Expr {
        public Index {
            Objects.requireNonNull(array, "array cannot be null");
            Objects.requireNonNull(index, "index cannot be null");
        }
    }

    /**
     * Struct member access: {@code s.field} or, when {@code throughPointer}, {@code s->field}.
     */
    public record FieldAccess(Expr base, String field, boolean throughPointer) implements Expr {
        public FieldAccess {
            Objects.requireNonNull(base, "base cannot be null");
            requireName(field);
        }
    }

    public record SizeOf(Type type) implements Expr {
        public SizeOf {
            Objects.requireNonNull(type, "type cannot be null");
        }
    }

    // ==================== Statements ====================

    /**
     * Base interface for all statements.
     */
    public sealed interface Stmt permits VarDecl, Assign, IndexAssign, DerefAssign, If, While, For,
            Return, Break, Continue, ExprStmt {
    }

    public record VarDecl(String name, Type type, Optional<Expr> initializer) implements Stmt {
        public VarDecl {
            requireName(name);
            Objects.requireNonNull(type, "type cannot be null");
            Objects.requireNonNull(initializer, "initializer cannot be null");
        }

        public static VarDecl of(String name, Type type, Expr initializer) {
            return new VarDecl(name, type, Optional.of(initializer));
        }

        public static VarDecl uninitialized(String name, Type type) {
            return new VarDecl(name, type, Optional.empty());
        }
    }

    public record Assign(String target, Expr value) implements Stmt {
        public Assign {
            requireName(target);
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    public record IndexAssign(Expr array, Expr index, Expr value) implements Stmt {
        public IndexAssign {
            Objects.requireNonNull(array, "array cannot be null");
            Objects.requireNonNull(index, "index cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    /**
     * Store through a pointer: {@code *p = value}.
     */
    public record DerefAssign(Expr pointer, Expr value) implements Stmt {
        public DerefAssign {
            Objects.requireNonNull(pointer, "pointer cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    /**
     * Conditional. An empty else body means there is no else branch.
     */
    public record If(Expr condition, List<Stmt> thenBody, List<Stmt> elseBody) implements Stmt {
        public If {
            Objects.requireNonNull(condition, "condition cannot be null");
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }

        public static If of(Expr condition, List<Stmt> thenBody) {
            return new If(condition, thenBody, List.of());
        }

        public boolean hasElse() {
            return !elseBody.isEmpty();
        }
    }

    public record While(Expr condition, List<Stmt> body) implements Stmt {
        public While {
            Objects.requireNonNull(condition, "condition cannot be null");
            body = List.copyOf(body);
        }
    }

    public record For(Optional<Stmt> init, Expr condition, Optional<Stmt> increment, List<Stmt> body)
            implements Stmt {
        public For {
            Objects.requireNonNull(init, "init cannot be null");
            Objects.requireNonNull(condition, "condition cannot be null");
            Objects.requireNonNull(increment, "increment cannot be null");
            body = List.copyOf(body);
        }
    }

    public record Return(Optional<Expr> value) implements Stmt {
        public Return {
            Objects.requireNonNull(value, "value cannot be null");
        }

        public static Return of(Expr value) {
            return new Return(Optional.of(value));
        }

        public static Return empty() {
            return new Return(Optional.empty());
        }
    }

    public record Break() implements Stmt {}

    public record Continue() implements Stmt {}

    /**
     * Expression evaluated for its side effects: {@code free(p);}, {@code i++;}
     */
    public record ExprStmt(Expr expr) implements Stmt {
        public ExprStmt {
            Objects.requireNonNull(expr, "expr cannot be null");
        }
    }

    // ==================== Functions ====================

    public record Param(String name, Type type) {
        public Param {
            requireName(name);
            Objects.requireNonNull(type, "type cannot be null");
        }
    }

    public record Function(String name, Type returnType, List<Param> params, List<Stmt> body) {
        public Function {
            requireName(name);
            Objects.requireNonNull(returnType, "returnType cannot be null");
            params = List.copyOf(params);
            body = List.copyOf(body);
        }

        public boolean isMain() {
            return name.equals("main");
        }
    }

    /**
     * A translation unit: the functions of one C source file in declaration order.
     */
    public record Program(List<Function> functions) {
        public Program {
            functions = List.copyOf(functions);
        }

        public Optional<Function> function(String name) {
            return functions.stream().filter(f -> f.name().equals(name)).findFirst();
        }
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }
}
