package io.surfworks.oxbow.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.oxbow.codegen.CodegenContext.Binding;
import io.surfworks.oxbow.codegen.CodegenContext.Storage;
import io.surfworks.oxbow.codegen.FormatTranslator.Conversion;
import io.surfworks.oxbow.codegen.FormatTranslator.Translation;
import io.surfworks.oxbow.detect.AllocationShapes;
import io.surfworks.oxbow.detect.StringShapes;
import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.Binary;
import io.surfworks.oxbow.ir.IrAst.BinaryOp;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.FieldAccess;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.Index;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.LiteralKind;
import io.surfworks.oxbow.ir.IrAst.Param;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.Scalar;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.SizeOf;
import io.surfworks.oxbow.ir.IrAst.Type;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarRef;

/**
 * Renders IR expressions as Rust expressions.
 *
 * Three renderings exist for every expression: {@link #value} yields it in its own
 * C type, {@link #coerced} converts it to a requested type, and {@link #condition}
 * yields a {@code bool} following C truthiness. Variables upgraded to owning storage
 * render through their safe API; everything else stays raw and touches memory
 * only inside {@code unsafe} blocks.
 */
final class ExpressionRenderer {

    /**
     * An assignable location. {@code needsUnsafe} is set when reaching it dereferences a raw pointer.
     */
    record Place(String text, boolean needsUnsafe) {
        String asReference() {
            return needsUnsafe ? "unsafe { &mut " + text + " }" : "&mut " + text;
        }

        String asValue() {
            return needsUnsafe ? "unsafe { " + text + " }" : text;
        }
    }

    private final CodegenContext ctx;

    ExpressionRenderer(CodegenContext ctx) {
        this.ctx = ctx;
    }

    // ==================== Types ====================

    Type typeOf(Expr expr) throws CodegenException {
        if (expr instanceof Literal lit) {
            return switch (lit.kind()) {
                case INT -> ScalarType.INT;
                case FLOAT -> ScalarType.FLOAT;
                case CHAR -> ScalarType.CHAR;
                case STRING -> new PointerType(ScalarType.CHAR);
                case NULL -> new PointerType(ScalarType.VOID);
            };
        }
        if (expr instanceof VarRef v) {
            return ctx.lookup(v.name()).type();
        }
        if (expr instanceof Unary u) {
            if (u.op() == UnaryOp.LOGICAL_NOT) {
                return ScalarType.INT;
            }
            if (u.op() == UnaryOp.ADDRESS_OF) {
                return new PointerType(typeOf(u.operand()));
            }
            if (u.op() == UnaryOp.DEREFERENCE) {
                return elementOf(u.operand(), "dereference");
            }
            Type operand = typeOf(u.operand());
            boolean promotes = u.op() == UnaryOp.NEGATE || u.op() == UnaryOp.BITWISE_NOT;
            return promotes && isChar(operand) ? ScalarType.INT : operand;
        }
        if (expr instanceof Binary b) {
            if (b.op().isComparison() || b.op().isLogical()) {
                return ScalarType.INT;
            }
            Type lhs = decay(typeOf(b.lhs()));
            Type rhs = decay(typeOf(b.rhs()));
            if (lhs.isPointer() && rhs.isPointer()) {
                return ScalarType.INT;
            }
            if (lhs.isPointer()) {
                return lhs;
            }
            if (rhs.isPointer()) {
                return rhs;
            }
            return isFloat(lhs) || isFloat(rhs) ? ScalarType.FLOAT : ScalarType.INT;
        }
        if (expr instanceof Call c) {
            return callType(c);
        }
        if (expr instanceof Index ix) {
            return elementOf(ix.array(), "index");
        }
        if (expr instanceof FieldAccess || expr instanceof SizeOf) {
            // struct layouts are not modelled; members are treated as int
            return ScalarType.INT;
        }
        throw new IllegalStateException("Unhandled expression: " + expr);
    }

    private Type callType(Call c) {
        switch (c.function()) {
            case AllocationShapes.MALLOC, AllocationShapes.CALLOC:
                return new PointerType(ScalarType.VOID);
            case AllocationShapes.FREE, "exit":
                return ScalarType.VOID;
            default:
                Optional<Function> user = ctx.signature(c.function());
                if (user.isPresent()) {
                    return user.get().returnType();
                }
                return LibcFunctions.lookup(c.function()).map(f -> f.returns().irType()).orElse(ScalarType.INT);
        }
    }

    private Type elementOf(Expr base, String operation) throws CodegenException {
        Type type = typeOf(base);
        if (type instanceof PointerType p) {
            if (p.pointee().isVoid()) {
                throw new CodegenException("Cannot " + operation + " void pointer: " + base);
            }
            return p.pointee();
        }
        if (type instanceof ArrayType a) {
            return a.element();
        }
        throw new CodegenException("Cannot " + operation + " expression of type "
                + type.toCString() + ": " + base);
    }

    static Type decay(Type type) {
        return type instanceof ArrayType a ? new PointerType(a.element()) : type;
    }

    private static boolean isFloat(Type type) {
        return type instanceof ScalarType s && s.kind() == Scalar.FLOAT;
    }

    private static boolean isChar(Type type) {
        return type instanceof ScalarType s && s.kind() == Scalar.CHAR;
    }

    private static boolean isInt(Type type) {
        return type instanceof ScalarType s && s.kind() == Scalar.INT;
    }

    // ==================== Values ====================

    String value(Expr expr) throws CodegenException {
        if (expr instanceof Literal lit) {
            return literal(lit);
        }
        if (expr instanceof VarRef v) {
            return variable(v);
        }
        if (expr instanceof Unary u) {
            return unary(u);
        }
        if (expr instanceof Binary b) {
            return binary(b);
        }
        if (expr instanceof Call c) {
            return call(c);
        }
        if (expr instanceof Index || expr instanceof FieldAccess) {
            return place(expr).asValue();
        }
        if (expr instanceof SizeOf s) {
            return RustSyntax.cast(sizeOf(s), "i32");
        }
        throw new IllegalStateException("Unhandled expression: " + expr);
    }

    /**
     * Renders an expression converted to the target type.
     */
    String coerced(Expr expr, Type target) throws CodegenException {
        Type decayed = decay(target);
        if (decayed instanceof PointerType ptr) {
            if (isNullConstant(expr)) {
                return RustSyntax.NULL_POINTER;
            }
            if (AllocationShapes.isAllocation(expr)) {
                return allocation((Call) expr, ptr);
            }
        }
        if (expr instanceof Literal lit && lit.kind() == LiteralKind.INT && isFloat(decayed)) {
            return floatLiteral(lit.text());
        }
        Type source = decay(typeOf(expr));
        String text = value(expr);
        if (source.equals(decayed)) {
            return text;
        }
        if (source instanceof ScalarType && decayed instanceof ScalarType) {
            if (source.isVoid() || decayed.isVoid()) {
                throw new CodegenException("Void value used as " + decayed.toCString() + ": " + expr);
            }
            return RustSyntax.cast(text, RustSyntax.type(decayed));
        }
        if (source instanceof PointerType && decayed instanceof PointerType) {
            return RustSyntax.cast(text, RustSyntax.type(decayed));
        }
        throw new CodegenException("Cannot convert " + source.toCString() + " to "
                + decayed.toCString() + ": " + expr);
    }

    private String literal(Literal lit) throws CodegenException {
        return switch (lit.kind()) {
            case INT -> lit.text().startsWith("-") ? "(" + lit.text() + ")" : lit.text();
            case FLOAT -> floatLiteral(lit.text());
            case CHAR -> {
                if (lit.text().length() != 1) {
                    throw new CodegenException("Character literal must hold one character: '" + lit.text() + "'");
                }
                yield RustSyntax.byteLiteral(lit.text().charAt(0));
            }
            case STRING -> "(b\"" + RustSyntax.escapeString(lit.text()) + "\\0\".as_ptr() as *mut u8)";
            case NULL -> RustSyntax.NULL_POINTER;
        };
    }

    private static String floatLiteral(String text) {
        String digits = text;
        if (digits.endsWith("f") || digits.endsWith("F")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        if (!digits.contains(".") && !digits.contains("e") && !digits.contains("E")) {
            digits = digits + ".0";
        }
        return digits.startsWith("-") ? "(" + digits + ")" : digits;
    }

    private String variable(VarRef v) throws CodegenException {
        Binding binding = ctx.lookup(v.name());
        String name = RustSyntax.name(v.name());
        return switch (binding.storage()) {
            case RAW -> binding.type() instanceof ArrayType ? name + ".as_mut_ptr()" : name;
            case BOX -> "(&mut *" + name + " as *mut " + pointeeType(binding) + ")";
            case VEC -> name + ".as_mut_ptr()";
            case OPTION -> name + ".as_deref_mut().map_or(" + RustSyntax.NULL_POINTER
                    + ", |r| r as *mut " + pointeeType(binding) + ")";
            case STRING -> throw stringAsPointer(v);
        };
    }

    private static CodegenException stringAsPointer(VarRef v) {
        return new CodegenException("String variable '" + v.name() + "' cannot be used as a raw pointer");
    }

    /**
     * Returns the Rust name of a variable upgraded to an owned {@code String}.
     */
    private Optional<String> ownedString(Expr expr) throws CodegenException {
        if (expr instanceof VarRef v && ctx.storageOf(v.name()) == Storage.STRING) {
            return Optional.of(RustSyntax.name(v.name()));
        }
        return Optional.empty();
    }

    /**
     * Renders the source of {@code strcpy} into an owned {@code String}.
     */
    String copiedString(Expr source) throws CodegenException {
        if (source instanceof Literal lit && lit.kind() == LiteralKind.STRING) {
            return "String::from(\"" + RustSyntax.escapeString(lit.text()) + "\")";
        }
        throw new CodegenException("Only string literals can be copied into an owned string: " + source);
    }

    private static String pointeeType(Binding binding) {
        return RustSyntax.pointee(((PointerType) binding.type()).pointee());
    }

    private String unary(Unary u) throws CodegenException {
        Expr operand = u.operand();
        switch (u.op()) {
            case PRE_INCREMENT, PRE_DECREMENT, POST_INCREMENT, POST_DECREMENT:
                return stepValue(u);
            case NEGATE:
                return "-" + prefixOperand(operand, promoted(operand));
            case BITWISE_NOT:
                return "!" + prefixOperand(operand, promoted(operand));
            case LOGICAL_NOT:
                return RustSyntax.cast(condition(u), "i32");
            case DEREFERENCE:
                return derefPlace(operand).asValue();
            case ADDRESS_OF:
                return addressOf(operand);
            default:
                throw new IllegalStateException("Unhandled operator: " + u.op());
        }
    }

    private String promoted(Expr expr) throws CodegenException {
        return isChar(typeOf(expr)) ? coerced(expr, ScalarType.INT) : value(expr);
    }

    private static String prefixOperand(Expr expr, String text) {
        if (expr instanceof Binary || text.startsWith("-") || isBlock(text)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static boolean isBlock(String text) {
        return text.startsWith("{") || text.startsWith("unsafe");
    }

    private static String operand(String text) {
        return isBlock(text) ? "(" + text + ")" : text;
    }

    private String addressOf(Expr operand) throws CodegenException {
        Type type = typeOf(operand);
        Place place = place(operand);
        return "(" + place.asReference() + " as *mut " + RustSyntax.pointee(type) + ")";
    }

    private String binary(Binary b) throws CodegenException {
        if (b.op().isComparison() || b.op().isLogical()) {
            return RustSyntax.cast(condition(b), "i32");
        }
        Type lhs = decay(typeOf(b.lhs()));
        Type rhs = decay(typeOf(b.rhs()));
        if (lhs.isPointer() || rhs.isPointer()) {
            return pointerArithmetic(b, lhs, rhs);
        }
        Type common = isFloat(lhs) || isFloat(rhs) ? ScalarType.FLOAT : ScalarType.INT;
        return arithmeticOperand(b.lhs(), common, b.op(), false)
                + " " + b.op().symbol() + " "
                + arithmeticOperand(b.rhs(), common, b.op(), true);
    }

    private String arithmeticOperand(Expr expr, Type common, BinaryOp parent, boolean right)
            throws CodegenException {
        String text = coerced(expr, common);
        boolean converted = !decay(typeOf(expr)).equals(common);
        if (!converted && expr instanceof Binary child && needsParens(parent, child.op(), right)) {
            return "(" + text + ")";
        }
        return operand(text);
    }

    /**
     * Parenthesizes a child operation by its C precedence. Bitwise and shift operators
     * are always grouped explicitly since Rust ranks them differently from C.
     */
    private static boolean needsParens(BinaryOp parent, BinaryOp child, boolean right) {
        if (child.isComparison() || child.isLogical()) {
            return false;
        }
        if (child.precedence() < parent.precedence()) {
            return true;
        }
        if (child.precedence() == parent.precedence()) {
            return right;
        }
        return isBitwise(child) || isBitwise(parent);
    }

    private static boolean isBitwise(BinaryOp op) {
        return op == BinaryOp.BIT_AND || op == BinaryOp.BIT_OR || op == BinaryOp.BIT_XOR
                || op == BinaryOp.SHL || op == BinaryOp.SHR;
    }

    private String pointerArithmetic(Binary b, Type lhs, Type rhs) throws CodegenException {
        if (lhs.isPointer() && rhs.isPointer()) {
            if (b.op() != BinaryOp.SUB) {
                throw new CodegenException("Unsupported operation on two pointers: " + b);
            }
            return "(unsafe { " + RustSyntax.paren(value(b.lhs())) + ".offset_from("
                    + value(b.rhs()) + ") } as i32)";
        }
        Expr pointer = lhs.isPointer() ? b.lhs() : b.rhs();
        Expr offset = lhs.isPointer() ? b.rhs() : b.lhs();
        String base = RustSyntax.paren(value(pointer));
        String distance = RustSyntax.paren(coerced(offset, ScalarType.INT)) + " as isize";
        if (b.op() == BinaryOp.ADD) {
            return base + ".wrapping_offset(" + distance + ")";
        }
        if (b.op() == BinaryOp.SUB && lhs.isPointer()) {
            return base + ".wrapping_offset(-(" + distance + "))";
        }
        throw new CodegenException("Unsupported pointer arithmetic: " + b);
    }

    // ==================== Conditions ====================

    /**
     * Renders an expression as a Rust {@code bool}: comparisons and logical operators
     * directly, anything else as a test against zero or null.
     */
    String condition(Expr expr) throws CodegenException {
        if (expr instanceof Binary b) {
            if (b.op().isLogical()) {
                return logicalOperand(b.lhs(), b.op()) + " " + b.op().symbol() + " "
                        + logicalOperand(b.rhs(), b.op());
            }
            if (b.op().isComparison()) {
                return comparison(b);
            }
        }
        if (expr instanceof Unary u && u.op() == UnaryOp.LOGICAL_NOT) {
            if (decay(typeOf(u.operand())).isPointer()) {
                return nullCheck(u.operand(), true);
            }
            return negate(condition(u.operand()));
        }
        if (decay(typeOf(expr)).isPointer()) {
            return nullCheck(expr, false);
        }
        String text = operand(value(expr));
        return isFloat(typeOf(expr)) ? text + " != 0.0" : text + " != 0";
    }

    private String logicalOperand(Expr expr, BinaryOp parent) throws CodegenException {
        String text = condition(expr);
        if (expr instanceof Binary b && b.op().isLogical() && b.op() != parent) {
            return "(" + text + ")";
        }
        return text;
    }

    private static String negate(String condition) {
        return condition.contains(" ") ? "!(" + condition + ")" : "!" + condition;
    }

    private String comparison(Binary b) throws CodegenException {
        boolean equality = b.op() == BinaryOp.EQ || b.op() == BinaryOp.NE;
        if (equality && isNullConstant(b.rhs()) && isPointerLike(b.lhs())) {
            return nullCheck(b.lhs(), b.op() == BinaryOp.EQ);
        }
        if (equality && isNullConstant(b.lhs()) && isPointerLike(b.rhs())) {
            return nullCheck(b.rhs(), b.op() == BinaryOp.EQ);
        }

        Type lhs = decay(typeOf(b.lhs()));
        Type rhs = decay(typeOf(b.rhs()));
        if (lhs.isPointer() || rhs.isPointer()) {
            return operand(value(b.lhs())) + " " + b.op().symbol() + " " + operand(value(b.rhs()));
        }
        Type common;
        if (isFloat(lhs) || isFloat(rhs)) {
            common = ScalarType.FLOAT;
        } else if (isChar(lhs) && isChar(rhs)) {
            common = ScalarType.CHAR;
        } else {
            common = ScalarType.INT;
        }
        return arithmeticOperand(b.lhs(), common, b.op(), false) + " " + b.op().symbol() + " "
                + arithmeticOperand(b.rhs(), common, b.op(), true);
    }

    private boolean isPointerLike(Expr expr) throws CodegenException {
        return decay(typeOf(expr)).isPointer();
    }

    private static boolean isNullConstant(Expr expr) {
        return expr instanceof Literal lit
                && (lit.isNull() || (lit.kind() == LiteralKind.INT && lit.text().equals("0")));
    }

    private String nullCheck(Expr pointer, boolean isNull) throws CodegenException {
        if (pointer instanceof VarRef v) {
            Storage storage = ctx.storageOf(v.name());
            String name = RustSyntax.name(v.name());
            if (storage == Storage.OPTION) {
                return name + (isNull ? ".is_none()" : ".is_some()");
            }
            if (storage.isOwned()) {
                return isNull ? "false" : "true";
            }
        }
        String test = RustSyntax.paren(value(pointer)) + ".is_null()";
        return isNull ? test : "!" + test;
    }

    // ==================== Places ====================

    /**
     * Renders an lvalue.
     *
     * @throws CodegenException if the expression is not assignable
     */
    Place place(Expr expr) throws CodegenException {
        if (expr instanceof VarRef v) {
            Binding binding = ctx.lookup(v.name());
            if (binding.storage().isOwned()) {
                throw new CodegenException("Owned variable '" + v.name() + "' (" + binding.storage()
                        + ") cannot be used as a raw lvalue");
            }
            return new Place(RustSyntax.name(v.name()), false);
        }
        if (expr instanceof Unary u && u.op() == UnaryOp.DEREFERENCE) {
            return derefPlace(u.operand());
        }
        if (expr instanceof Index ix) {
            return indexPlace(ix);
        }
        if (expr instanceof FieldAccess f) {
            String field = RustSyntax.name(f.field());
            if (f.throughPointer()) {
                Place target = derefPlace(f.base());
                return new Place("(" + target.text() + ")." + field, target.needsUnsafe());
            }
            Place base = place(f.base());
            return new Place(base.text() + "." + field, base.needsUnsafe());
        }
        throw new CodegenException("Expression is not an lvalue: " + expr);
    }

    static boolean isLvalue(Expr expr) {
        return expr instanceof VarRef
                || expr instanceof Index
                || expr instanceof FieldAccess
                || (expr instanceof Unary u && u.op() == UnaryOp.DEREFERENCE);
    }

    private Place derefPlace(Expr pointer) throws CodegenException {
        if (pointer instanceof VarRef v) {
            Binding binding = ctx.lookup(v.name());
            String name = RustSyntax.name(v.name());
            switch (binding.storage()) {
                case BOX:
                    return new Place("*" + name, false);
                case VEC:
                    return new Place(name + "[0]", false);
                case OPTION:
                    return new Place("**" + name + ".as_mut().unwrap()", false);
                case STRING:
                    throw stringAsPointer(v);
                default:
                    if (binding.type() instanceof ArrayType) {
                        return new Place(name + "[0]", false);
                    }
            }
        }
        elementOf(pointer, "dereference");
        return new Place("*" + RustSyntax.paren(value(pointer)), true);
    }

    private Place indexPlace(Index ix) throws CodegenException {
        Expr base = ix.array();
        if (base instanceof VarRef v) {
            Binding binding = ctx.lookup(v.name());
            String name = RustSyntax.name(v.name());
            switch (binding.storage()) {
                case VEC:
                    return new Place(name + "[" + indexText(ix.index()) + "]", false);
                case BOX, OPTION:
                    if (isNullConstant(ix.index())) {
                        return derefPlace(base);
                    }
                    throw new CodegenException("Cannot index single-object allocation '" + v.name()
                            + "': " + ix);
                case STRING:
                    throw stringAsPointer(v);
                default:
                    break;
            }
        }
        Type type = typeOf(base);
        if (type instanceof ArrayType a && a.length().isPresent()) {
            Place array = place(base);
            return new Place(array.text() + "[" + indexText(ix.index()) + "]", array.needsUnsafe());
        }
        elementOf(base, "index");
        String offset = RustSyntax.paren(coerced(ix.index(), ScalarType.INT)) + " as isize";
        return new Place("*" + RustSyntax.paren(value(base)) + ".offset(" + offset + ")", true);
    }

    /**
     * Renders an index for a bounds-checked slice access.
     */
    String indexText(Expr index) throws CodegenException {
        if (index instanceof Literal lit && lit.kind() == LiteralKind.INT && !lit.text().startsWith("-")) {
            return lit.text();
        }
        return RustSyntax.paren(coerced(index, ScalarType.INT)) + " as usize";
    }

    // ==================== Increment and decrement ====================

    /**
     * Renders {@code ++x}, {@code x--} and friends as a block expression.
     * Prefix forms mutate then yield the new value; postfix forms capture the old value,
     * mutate, and yield the old value. Non-variable operands are bound once through a
     * mutable reference so they are evaluated exactly once.
     */
    private String stepValue(Unary u) throws CodegenException {
        Expr target = u.operand();
        boolean increment = u.op().isIncrement();
        if (target instanceof VarRef v) {
            String name = steppableVariable(v, u);
            String update = stepUpdate(name, ctx.lookup(v.name()).type(), increment);
            return u.op().isPrefix()
                    ? "{ " + update + "; " + name + " }"
                    : "{ let __tmp = " + name + "; " + update + "; __tmp }";
        }
        requireLvalue(target, increment);
        String bind = "let __p = " + place(target).asReference() + "; ";
        String update = stepUpdate("*__p", typeOf(target), increment);
        return u.op().isPrefix()
                ? "{ " + bind + update + "; *__p }"
                : "{ " + bind + "let __tmp = *__p; " + update + "; __tmp }";
    }

    /**
     * Renders an increment or decrement whose value is discarded.
     */
    String stepStatement(Unary u) throws CodegenException {
        Expr target = u.operand();
        boolean increment = u.op().isIncrement();
        if (target instanceof VarRef v) {
            String name = steppableVariable(v, u);
            return stepUpdate(name, ctx.lookup(v.name()).type(), increment) + ";";
        }
        requireLvalue(target, increment);
        Place place = place(target);
        Type type = typeOf(target);
        if (isInt(type) || isFloat(type)) {
            String update = stepUpdate(place.text(), type, increment) + ";";
            return place.needsUnsafe() ? "unsafe { " + update + " }" : update;
        }
        return "{ let __p = " + place.asReference() + "; " + stepUpdate("*__p", type, increment) + "; }";
    }

    private String steppableVariable(VarRef v, Unary u) throws CodegenException {
        Binding binding = ctx.lookup(v.name());
        if (binding.storage().isOwned()) {
            throw new CodegenException("Pointer arithmetic on owned variable '" + v.name() + "': " + u);
        }
        if (binding.type() instanceof ArrayType) {
            throw new CodegenException("Cannot modify array '" + v.name() + "': " + u);
        }
        return RustSyntax.name(v.name());
    }

    private static void requireLvalue(Expr target, boolean increment) throws CodegenException {
        if (!isLvalue(target)) {
            throw new CodegenException("Cannot " + (increment ? "increment" : "decrement")
                    + " non-lvalue expression: " + target);
        }
    }

    private static String stepUpdate(String lvalue, Type type, boolean increment) {
        if (isInt(type)) {
            return lvalue + (increment ? " += 1" : " -= 1");
        }
        if (isFloat(type)) {
            return lvalue + (increment ? " += 1.0" : " -= 1.0");
        }
        String receiver = lvalue.startsWith("*") ? "(" + lvalue + ")" : lvalue;
        return lvalue + " = " + receiver + (increment ? ".wrapping_add(1)" : ".wrapping_sub(1)");
    }

    // ==================== Calls ====================

    String call(Call c) throws CodegenException {
        switch (c.function()) {
            case AllocationShapes.MALLOC, AllocationShapes.CALLOC:
                if (!AllocationShapes.isAllocation(c)) {
                    throw new CodegenException("Wrong number of arguments to " + c.function() + ": " + c);
                }
                return allocation(c, null);
            case AllocationShapes.FREE:
                return release(c);
            case "printf", "puts", "putchar":
                return "{ " + output(c) + "; 0 }";
            case "exit":
                return "std::process::exit(" + coerced(single(c), ScalarType.INT) + ")";
            case "abs":
                return "i32::abs(" + coerced(single(c), ScalarType.INT) + ")";
            case StringShapes.STRLEN:
                Optional<String> owned = c.args().size() == 1 ? ownedString(c.args().get(0)) : Optional.empty();
                if (owned.isPresent()) {
                    return "(" + owned.get() + ".len() as i32)";
                }
                return libcOrUserCall(c);
            default:
                return libcOrUserCall(c);
        }
    }

    private String libcOrUserCall(Call c) throws CodegenException {
        Optional<LibcFunctions.Signature> libc = LibcFunctions.lookup(c.function());
        if (ctx.signature(c.function()).isEmpty() && libc.isPresent()) {
            return libcCall(c, libc.get());
        }
        return userCall(c);
    }

    /**
     * Renders a raw call into the C library. {@code size_t} arguments are converted from
     * int and a {@code size_t} result is narrowed back to int.
     */
    private String libcCall(Call c, LibcFunctions.Signature function) throws CodegenException {
        List<LibcFunctions.CType> params = function.params();
        if (params.size() != c.args().size()) {
            throw new CodegenException("Call to " + c.function() + " passes " + c.args().size()
                    + " argument(s), expected " + params.size() + ": " + c);
        }
        ctx.useExtern(function.name());
        List<String> args = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            Expr arg = c.args().get(i);
            args.add(params.get(i) == LibcFunctions.CType.SIZE
                    ? byteCount(arg)
                    : coerced(arg, params.get(i).irType()));
        }
        String call = "unsafe { " + function.name() + "(" + String.join(", ", args) + ") }";
        return function.returns() == LibcFunctions.CType.SIZE ? "(" + call + " as i32)" : call;
    }

    /**
     * Renders a call whose result is discarded, including the trailing semicolon.
     */
    String callStatement(Call c) throws CodegenException {
        switch (c.function()) {
            case "printf", "puts", "putchar":
                return output(c) + ";";
            case AllocationShapes.MALLOC, AllocationShapes.CALLOC:
                return "let _ = " + call(c) + ";";
            default:
                return call(c) + ";";
        }
    }

    private String allocation(Call c, PointerType target) throws CodegenException {
        ctx.useExtern(c.function());
        String element = target == null ? RustSyntax.C_VOID : RustSyntax.pointee(target.pointee());
        List<String> sizes = new ArrayList<>();
        for (Expr arg : c.args()) {
            sizes.add(byteCount(arg));
        }
        return "unsafe { " + c.function() + "(" + String.join(", ", sizes) + ") as *mut " + element + " }";
    }

    private String byteCount(Expr size) throws CodegenException {
        if (size instanceof SizeOf s) {
            return sizeOf(s);
        }
        return RustSyntax.paren(coerced(size, ScalarType.INT)) + " as usize";
    }

    private static String sizeOf(SizeOf s) {
        return "std::mem::size_of::<" + RustSyntax.pointee(s.type()) + ">()";
    }

    private String release(Call c) throws CodegenException {
        Expr pointer = single(c);
        if (pointer instanceof VarRef v && ctx.storageOf(v.name()).isOwned()) {
            throw new CodegenException("Owned variable '" + v.name() + "' released inside an expression: " + c);
        }
        ctx.useExtern(AllocationShapes.FREE);
        return "unsafe { free(" + RustSyntax.paren(value(pointer)) + " as *mut " + RustSyntax.C_VOID + ") }";
    }

    private String output(Call c) throws CodegenException {
        if (c.calls("putchar")) {
            return "print!(\"{}\", char::from(" + coerced(single(c), ScalarType.CHAR) + "))";
        }
        if (c.calls("puts")) {
            Expr text = single(c);
            if (text instanceof Literal lit && lit.kind() == LiteralKind.STRING) {
                return "println!(\"" + formatText(lit.text()) + "\")";
            }
            Optional<String> owned = ownedString(text);
            if (owned.isPresent()) {
                return "println!(\"{}\", " + owned.get() + ")";
            }
            return "println!(\"{}\", " + cString(text) + ")";
        }
        return printf(c);
    }

    private String printf(Call c) throws CodegenException {
        if (c.args().isEmpty()
                || !(c.args().get(0) instanceof Literal fmt)
                || fmt.kind() != LiteralKind.STRING) {
            throw new CodegenException("printf requires a literal format string: " + c);
        }
        Translation translation = FormatTranslator.translate(fmt.text());
        List<Expr> args = c.args().subList(1, c.args().size());
        if (translation.conversions().size() != args.size()) {
            throw new CodegenException("printf format \"" + fmt.text() + "\" expects "
                    + translation.conversions().size() + " argument(s), got " + args.size());
        }

        StringBuilder sb = new StringBuilder("print!(\"").append(translation.format()).append('"');
        for (int i = 0; i < args.size(); i++) {
            sb.append(", ").append(formatArgument(args.get(i), translation.conversions().get(i)));
        }
        return sb.append(')').toString();
    }

    private String formatArgument(Expr arg, Conversion conversion) throws CodegenException {
        return switch (conversion) {
            case INTEGER -> isChar(typeOf(arg)) ? coerced(arg, ScalarType.INT) : value(arg);
            case UNSIGNED -> RustSyntax.cast(coerced(arg, ScalarType.INT), "u32");
            case CHARACTER -> "char::from(" + coerced(arg, ScalarType.CHAR) + ")";
            case FLOAT -> coerced(arg, ScalarType.FLOAT);
            case STRING -> {
                if (arg instanceof Literal lit && lit.kind() == LiteralKind.STRING) {
                    yield "\"" + RustSyntax.escapeString(lit.text()) + "\"";
                }
                Optional<String> owned = ownedString(arg);
                yield owned.isPresent() ? owned.get() : cString(arg);
            }
        };
    }

    private String cString(Expr pointer) throws CodegenException {
        return "unsafe { std::ffi::CStr::from_ptr(" + RustSyntax.paren(value(pointer))
                + " as *const std::ffi::c_char) }.to_string_lossy()";
    }

    private static String formatText(String text) {
        return RustSyntax.escapeString(text).replace("{", "{{").replace("}", "}}");
    }

    private String userCall(Call c) throws CodegenException {
        Optional<Function> signature = ctx.signature(c.function());
        List<String> args = new ArrayList<>();
        if (signature.isPresent()) {
            List<Param> params = signature.get().params();
            if (params.size() != c.args().size()) {
                throw new CodegenException("Call to " + c.function() + " passes " + c.args().size()
                        + " argument(s), expected " + params.size() + ": " + c);
            }
            for (int i = 0; i < params.size(); i++) {
                args.add(coerced(c.args().get(i), params.get(i).type()));
            }
        } else {
            for (Expr arg : c.args()) {
                args.add(value(arg));
            }
        }
        return RustSyntax.name(c.function()) + "(" + String.join(", ", args) + ")";
    }

    private static Expr single(Call c) throws CodegenException {
        if (c.args().size() != 1) {
            throw new CodegenException(c.function() + " takes one argument: " + c);
        }
        return c.args().get(0);
    }
}
