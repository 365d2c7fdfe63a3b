package io.surfworks.oxbow.codegen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import io.surfworks.oxbow.detect.IdiomFamily;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.Type;

/**
 * Tracks variable bindings, loop labels and used C library primitives while one
 * translation unit is rendered.
 * Created per generator call and discarded afterwards.
 */
final class CodegenContext {

    /**
     * How a variable is stored in the generated Rust.
     */
    enum Storage {
        RAW, BOX, VEC, OPTION, STRING;

        static Storage of(IdiomFamily family) {
            return switch (family) {
                case HEAP_ALLOCATION -> BOX;
                case ARRAY_ALLOCATION -> VEC;
                case NULLABLE_POINTER -> OPTION;
                case STRING_COPY -> STRING;
            };
        }

        boolean isOwned() {
            return this != RAW;
        }
    }

    /**
     * A declared variable: its C type and how it is stored.
     */
    record Binding(String name, Type type, Storage storage) {}

    /**
     * An enclosing loop. Labels are null when plain {@code break}/{@code continue} suffice.
     *
     * @param breakLabel    label of the loop itself, used by {@code break}
     * @param continueLabel label of the loop body block, left by {@code continue}
     */
    record LoopFrame(String breakLabel, String continueLabel) {}

    private final Map<String, Function> signatures;
    private final Deque<Map<String, Binding>> scopes = new ArrayDeque<>();
    private final Deque<LoopFrame> loops = new ArrayDeque<>();
    private final Set<String> externs = new TreeSet<>();
    private Function function;
    private int labelCounter;

    CodegenContext(Map<String, Function> signatures) {
        this.signatures = Map.copyOf(signatures);
    }

    /**
     * Starts a function: resets scopes, loops and labels.
     */
    void beginFunction(Function func) {
        function = func;
        scopes.clear();
        loops.clear();
        labelCounter = 0;
        pushScope();
    }

    Function function() {
        return function;
    }

    void pushScope() {
        scopes.push(new HashMap<>());
    }

    void popScope() {
        scopes.pop();
    }

    void declare(String name, Type type, Storage storage) {
        scopes.peek().put(name, new Binding(name, type, storage));
    }

    /**
     * Resolves a variable through the enclosing scopes, innermost first.
     *
     * @throws CodegenException if the variable is not declared
     */
    Binding lookup(String name) throws CodegenException {
        for (Map<String, Binding> scope : scopes) {
            Binding binding = scope.get(name);
            if (binding != null) {
                return binding;
            }
        }
        throw new CodegenException("Unknown variable '" + name + "' in function " + function.name());
    }

    Storage storageOf(String name) throws CodegenException {
        return lookup(name).storage();
    }

    Optional<Function> signature(String name) {
        return Optional.ofNullable(signatures.get(name));
    }

    LoopFrame enterLoop(boolean labelled) {
        LoopFrame frame;
        if (labelled) {
            int id = labelCounter++;
            frame = new LoopFrame("'l" + id, "'b" + id);
        } else {
            frame = new LoopFrame(null, null);
        }
        loops.push(frame);
        return frame;
    }

    void exitLoop() {
        loops.pop();
    }

    LoopFrame currentLoop(String statement) throws CodegenException {
        LoopFrame frame = loops.peek();
        if (frame == null) {
            throw new CodegenException("'" + statement + "' outside of a loop in function " + function.name());
        }
        return frame;
    }

    /**
     * Records that a C library primitive needs an {@code extern "C"} declaration.
     */
    void useExtern(String name) {
        externs.add(name);
    }

    Set<String> externs() {
        return externs;
    }
}
