package io.surfworks.oxbow.codegen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.surfworks.oxbow.codegen.CodegenContext.Binding;
import io.surfworks.oxbow.codegen.CodegenContext.LoopFrame;
import io.surfworks.oxbow.codegen.CodegenContext.Storage;
import io.surfworks.oxbow.detect.AllocationShapes;
import io.surfworks.oxbow.detect.IdiomFamily;
import io.surfworks.oxbow.detect.IdiomPattern;
import io.surfworks.oxbow.detect.RewriteCandidate;
import io.surfworks.oxbow.detect.StringCopyPattern;
import io.surfworks.oxbow.detect.StringShapes;
import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.Assign;
import io.surfworks.oxbow.ir.IrAst.Break;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Continue;
import io.surfworks.oxbow.ir.IrAst.DerefAssign;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.ExprStmt;
import io.surfworks.oxbow.ir.IrAst.For;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.If;
import io.surfworks.oxbow.ir.IrAst.Index;
import io.surfworks.oxbow.ir.IrAst.IndexAssign;
import io.surfworks.oxbow.ir.IrAst.Param;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.Return;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.Stmt;
import io.surfworks.oxbow.ir.IrAst.Type;
import io.surfworks.oxbow.ir.IrAst.Unary;
import io.surfworks.oxbow.ir.IrAst.UnaryOp;
import io.surfworks.oxbow.ir.IrAst.VarDecl;
import io.surfworks.oxbow.ir.IrAst.VarRef;
import io.surfworks.oxbow.ir.IrAst.While;

/**
 * Emits Rust source for one translation unit, one function at a time.
 * Not thread-safe; a fresh emitter is created per generator call.
 */
final class RustEmitter {

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private final CodegenContext ctx;
    private final ExpressionRenderer expr;
    private int indent;

    RustEmitter(CodegenContext ctx) {
        this.ctx = ctx;
        this.expr = new ExpressionRenderer(ctx);
    }

    String text() {
        return sb.toString();
    }

    void blankLine() {
        sb.append('\n');
    }

    // ==================== Functions ====================

    void emitFunction(Function func, List<RewriteCandidate> candidates) throws CodegenException {
        Map<Integer, RewriteCandidate> upgrades = indexCandidates(func, candidates);
        Set<Integer> elided = releases(func, upgrades.values());

        ctx.beginFunction(func);
        emitSignature(func);
        indent++;
        List<Stmt> body = func.body();
        for (int i = 0; i < body.size(); i++) {
            if (elided.contains(i)) {
                continue;
            }
            RewriteCandidate upgrade = upgrades.get(i);
            if (upgrade != null) {
                emitUpgradedDeclaration((VarDecl) body.get(i), upgrade);
            } else {
                emitStmt(body.get(i));
            }
        }
        indent--;
        emitLine("}");
    }

    private static Map<Integer, RewriteCandidate> indexCandidates(Function func, List<RewriteCandidate> candidates)
            throws CodegenException {
        Map<Integer, RewriteCandidate> byIndex = new HashMap<>();
        Set<String> variables = new HashSet<>();
        for (RewriteCandidate candidate : candidates) {
            int index = candidate.statementIndex();
            if (index >= func.body().size()) {
                throw new CodegenException("Rewrite candidate " + candidate + " is out of range for function "
                        + func.name() + " with " + func.body().size() + " statement(s)");
            }
            Stmt stmt = func.body().get(index);
            if (!(stmt instanceof VarDecl decl)
                    || !decl.name().equals(candidate.variable())
                    || !matchesFamily(decl, candidate)) {
                throw new CodegenException("Rewrite candidate " + candidate
                        + " does not point at a matching declaration: " + stmt);
            }
            if (byIndex.put(index, candidate) != null || !variables.add(candidate.variable())) {
                throw new CodegenException("Duplicate rewrite candidate " + candidate + " in function " + func.name());
            }
        }
        return byIndex;
    }

    private static boolean matchesFamily(VarDecl decl, RewriteCandidate candidate) {
        if (candidate.family() == IdiomFamily.STRING_COPY) {
            return StringCopyPattern.declaresCharBuffer(decl);
        }
        if (!IdiomPattern.declaresTypedPointer(decl) || decl.initializer().isEmpty()) {
            return false;
        }
        Expr init = decl.initializer().get();
        return switch (candidate.family()) {
            case HEAP_ALLOCATION, ARRAY_ALLOCATION -> candidate.family().canHold(init);
            case NULLABLE_POINTER -> AllocationShapes.isNullLiteral(init);
            case STRING_COPY -> false;
        };
    }

    private static Set<Integer> releases(Function func, Iterable<RewriteCandidate> candidates)
            throws CodegenException {
        Set<Integer> elided = new HashSet<>();
        for (RewriteCandidate candidate : candidates) {
            if (!candidate.hasRelease()) {
                continue;
            }
            int release = candidate.releaseIndex().getAsInt();
            if (release <= candidate.statementIndex()
                    || release >= func.body().size()
                    || !AllocationShapes.isRelease(func.body().get(release), candidate.variable())) {
                throw new CodegenException("Rewrite candidate " + candidate + " does not name a free("
                        + candidate.variable() + ") statement");
            }
            elided.add(release);
        }
        return elided;
    }

    private void emitSignature(Function func) throws CodegenException {
        if (func.isMain()) {
            if (!func.params().isEmpty()) {
                throw new CodegenException("main with parameters is not supported: " + func.params());
            }
            emitLine("fn main() {");
            return;
        }

        List<String> params = new ArrayList<>();
        for (Param param : func.params()) {
            if (param.type().isVoid()) {
                throw new CodegenException("Parameter '" + param.name() + "' of " + func.name() + " has type void");
            }
            Type type = ExpressionRenderer.decay(param.type());
            ctx.declare(param.name(), type, Storage.RAW);
            params.add("mut " + RustSyntax.name(param.name()) + ": " + RustSyntax.type(type));
        }
        if (func.returnType() instanceof ArrayType) {
            throw new CodegenException("Function " + func.name() + " cannot return an array");
        }
        String returns = func.returnType().isVoid() ? "" : " -> " + RustSyntax.type(func.returnType());
        emitLine("fn " + RustSyntax.name(func.name()) + "(" + String.join(", ", params) + ")" + returns + " {");
    }

    // ==================== Statements ====================

    private void emitStmt(Stmt stmt) throws CodegenException {
        if (stmt instanceof VarDecl decl) {
            emitDeclaration(decl);
        } else if (stmt instanceof Assign assign) {
            emitAssign(assign);
        } else if (stmt instanceof IndexAssign store) {
            Index target = new Index(store.array(), store.index());
            emitStore(expr.place(target), expr.typeOf(target), store.value());
        } else if (stmt instanceof DerefAssign store) {
            Unary target = new Unary(UnaryOp.DEREFERENCE, store.pointer());
            emitStore(expr.place(target), expr.typeOf(target), store.value());
        } else if (stmt instanceof If branch) {
            emitIf(branch, "");
        } else if (stmt instanceof While loop) {
            emitWhile(loop);
        } else if (stmt instanceof For loop) {
            emitFor(loop);
        } else if (stmt instanceof Return ret) {
            emitReturn(ret);
        } else if (stmt instanceof Break) {
            LoopFrame frame = ctx.currentLoop("break");
            emitLine(frame.breakLabel() == null ? "break;" : "break " + frame.breakLabel() + ";");
        } else if (stmt instanceof Continue) {
            LoopFrame frame = ctx.currentLoop("continue");
            emitLine(frame.continueLabel() == null ? "continue;" : "break " + frame.continueLabel() + ";");
        } else if (stmt instanceof ExprStmt es) {
            emitExprStmt(es.expr());
        } else {
            throw new IllegalStateException("Unhandled statement: " + stmt);
        }
    }

    private void emitDeclaration(VarDecl decl) throws CodegenException {
        Type type = decl.type();
        if (type.isVoid()) {
            throw new CodegenException("Variable '" + decl.name() + "' declared with type void");
        }
        String init;
        if (type instanceof ArrayType array) {
            if (array.length().isEmpty()) {
                throw new CodegenException("Array variable '" + decl.name() + "' needs a length");
            }
            if (decl.initializer().isPresent()) {
                throw new CodegenException("Array initializers are not supported: " + decl);
            }
            init = RustSyntax.zero(type);
        } else {
            init = decl.initializer().isPresent()
                    ? expr.coerced(decl.initializer().get(), type)
                    : RustSyntax.zero(type);
        }
        emitLine("let mut " + RustSyntax.name(decl.name()) + ": " + RustSyntax.type(type) + " = " + init + ";");
        ctx.declare(decl.name(), type, Storage.RAW);
    }

    private void emitUpgradedDeclaration(VarDecl decl, RewriteCandidate candidate) throws CodegenException {
        if (candidate.family() == IdiomFamily.STRING_COPY) {
            emitLine("let mut " + RustSyntax.name(decl.name()) + ": String = String::new();");
            ctx.declare(decl.name(), decl.type(), Storage.STRING);
            return;
        }
        Type pointee = ((PointerType) decl.type()).pointee();
        String name = RustSyntax.name(decl.name());
        String element = RustSyntax.type(pointee);
        switch (candidate.family()) {
            case HEAP_ALLOCATION -> emitLine("let mut " + name + ": Box<" + element + "> = Box::new("
                    + RustSyntax.zero(pointee) + ");");
            case ARRAY_ALLOCATION -> emitLine("let mut " + name + ": Vec<" + element + "> = "
                    + vector(decl.initializer().get(), pointee) + ";");
            case NULLABLE_POINTER -> emitLine("let mut " + name + ": Option<Box<" + element + ">> = None;");
        }
        ctx.declare(decl.name(), decl.type(), Storage.of(candidate.family()));
    }

    private String vector(Expr allocation, Type pointee) throws CodegenException {
        Expr count = AllocationShapes.elementCount(allocation).orElseThrow();
        return "vec![" + RustSyntax.zero(pointee) + "; " + expr.indexText(count) + "]";
    }

    private void emitAssign(Assign assign) throws CodegenException {
        Binding binding = ctx.lookup(assign.target());
        String name = RustSyntax.name(assign.target());
        Expr value = assign.value();
        switch (binding.storage()) {
            case RAW -> {
                if (binding.type() instanceof ArrayType) {
                    throw new CodegenException("Cannot assign to array '" + assign.target() + "'");
                }
                emitLine(name + " = " + expr.coerced(value, binding.type()) + ";");
            }
            case BOX -> {
                if (!AllocationShapes.isAllocation(value) || AllocationShapes.isArrayAllocation(value)) {
                    throw ownedReassignment(assign, binding);
                }
                emitLine(name + " = Box::new(" + RustSyntax.zero(pointee(binding)) + ");");
            }
            case VEC -> {
                if (!AllocationShapes.isArrayAllocation(value)) {
                    throw ownedReassignment(assign, binding);
                }
                emitLine(name + " = " + vector(value, pointee(binding)) + ";");
            }
            case OPTION -> {
                if (AllocationShapes.isNullLiteral(value)) {
                    emitLine(name + " = None;");
                } else if (AllocationShapes.isAllocation(value) && !AllocationShapes.isArrayAllocation(value)) {
                    emitLine(name + " = Some(Box::new(" + RustSyntax.zero(pointee(binding)) + "));");
                } else {
                    throw ownedReassignment(assign, binding);
                }
            }
            case STRING -> throw ownedReassignment(assign, binding);
        }
    }

    private static Type pointee(Binding binding) {
        return ((PointerType) binding.type()).pointee();
    }

    private static CodegenException ownedReassignment(Assign assign, Binding binding) {
        return new CodegenException("Cannot assign " + assign.value() + " to owned variable '"
                + assign.target() + "' (" + binding.storage() + ")");
    }

    private void emitStore(ExpressionRenderer.Place place, Type type, Expr value) throws CodegenException {
        String rendered = expr.coerced(value, type);
        if (place.needsUnsafe()) {
            emitLine("unsafe { " + place.text() + " = " + rendered + "; }");
        } else {
            emitLine(place.text() + " = " + rendered + ";");
        }
    }

    private void emitIf(If branch, String prefix) throws CodegenException {
        emitLine(prefix + "if " + expr.condition(branch.condition()) + " {");
        emitBody(branch.thenBody());
        if (branch.elseBody().size() == 1 && branch.elseBody().get(0) instanceof If chained) {
            emitIf(chained, "} else ");
            return;
        }
        if (branch.hasElse()) {
            emitLine("} else {");
            emitBody(branch.elseBody());
        }
        emitLine("}");
    }

    private void emitWhile(While loop) throws CodegenException {
        emitLine("while " + expr.condition(loop.condition()) + " {");
        ctx.enterLoop(false);
        emitBody(loop.body());
        ctx.exitLoop();
        emitLine("}");
    }

    /**
     * A for loop becomes a while loop in its own block. When the body continues,
     * the body is wrapped in a labelled block so that {@code continue} still runs
     * the increment.
     */
    private void emitFor(For loop) throws CodegenException {
        boolean scoped = loop.init().isPresent();
        if (scoped) {
            emitLine("{");
            indent++;
            ctx.pushScope();
            emitStmt(loop.init().get());
        }

        String condition = expr.condition(loop.condition());
        boolean labelled = continues(loop.body());
        LoopFrame frame = ctx.enterLoop(labelled);
        if (labelled) {
            emitLine(frame.breakLabel() + ": while " + condition + " {");
            indent++;
            emitLine(frame.continueLabel() + ": {");
            emitBody(loop.body());
            emitLine("}");
        } else {
            emitLine("while " + condition + " {");
            indent++;
            ctx.pushScope();
            for (Stmt stmt : loop.body()) {
                emitStmt(stmt);
            }
            ctx.popScope();
        }
        ctx.exitLoop();
        if (loop.increment().isPresent()) {
            emitStmt(loop.increment().get());
        }
        indent--;
        emitLine("}");

        if (scoped) {
            ctx.popScope();
            indent--;
            emitLine("}");
        }
    }

    /**
     * True if a continue in these statements targets the enclosing loop.
     */
    private static boolean continues(List<Stmt> body) {
        for (Stmt stmt : body) {
            if (stmt instanceof Continue) {
                return true;
            }
            if (stmt instanceof If branch && (continues(branch.thenBody()) || continues(branch.elseBody()))) {
                return true;
            }
        }
        return false;
    }

    private void emitReturn(Return ret) throws CodegenException {
        Function func = ctx.function();
        if (func.isMain()) {
            String code = ret.value().isPresent() ? expr.coerced(ret.value().get(), ScalarType.INT) : "0";
            emitLine("std::process::exit(" + code + ");");
            return;
        }
        if (func.returnType().isVoid()) {
            if (ret.value().isPresent()) {
                throw new CodegenException("void function " + func.name() + " returns a value: " + ret);
            }
            emitLine("return;");
            return;
        }
        if (ret.value().isEmpty()) {
            throw new CodegenException("Function " + func.name() + " must return a value");
        }
        emitLine("return " + expr.coerced(ret.value().get(), func.returnType()) + ";");
    }

    private void emitExprStmt(Expr e) throws CodegenException {
        if (e instanceof Unary u && u.op().isStep()) {
            emitLine(expr.stepStatement(u));
            return;
        }
        if (e instanceof Call call) {
            Optional<String> copyTarget = StringShapes.copyTarget(call);
            if (copyTarget.isPresent() && ctx.storageOf(copyTarget.get()) == Storage.STRING) {
                emitLine(RustSyntax.name(copyTarget.get()) + " = " + expr.copiedString(call.args().get(1)) + ";");
                return;
            }
            if (call.calls(AllocationShapes.FREE) && call.args().size() == 1
                    && call.args().get(0) instanceof VarRef v) {
                Storage storage = ctx.storageOf(v.name());
                if (storage == Storage.OPTION) {
                    emitLine(RustSyntax.name(v.name()) + " = None;");
                    return;
                }
                if (storage.isOwned()) {
                    // released when the owner goes out of scope
                    return;
                }
            }
            emitLine(expr.callStatement(call));
            return;
        }
        emitLine("let _ = " + expr.value(e) + ";");
    }

    private void emitBody(List<Stmt> body) throws CodegenException {
        indent++;
        ctx.pushScope();
        for (Stmt stmt : body) {
            emitStmt(stmt);
        }
        ctx.popScope();
        indent--;
    }

    private void emitLine(String line) {
        sb.append(INDENT.repeat(indent)).append(line).append('\n');
    }
}
