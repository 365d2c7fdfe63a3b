package io.surfworks.oxbow.codegen;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.Type;

/**
 * C library functions reachable from generated code through {@code extern "C"}.
 *
 * <p>The allocator functions are rendered specially by the expression renderer;
 * the string and memory functions are passed through as raw calls.
 */
final class LibcFunctions {

    /**
     * How a value crosses the C boundary.
     */
    enum CType {
        VOID, INT, SIZE, CHAR_POINTER, VOID_POINTER;

        /**
         * Returns the C type a value of this kind has on the calling side. {@code size_t}
         * results are narrowed to int.
         */
        Type irType() {
            return switch (this) {
                case VOID -> ScalarType.VOID;
                case INT, SIZE -> ScalarType.INT;
                case CHAR_POINTER -> new PointerType(ScalarType.CHAR);
                case VOID_POINTER -> new PointerType(ScalarType.VOID);
            };
        }
    }

    /**
     * One declared C function.
     *
     * @param name        the C name
     * @param returns     the result kind
     * @param params      the parameter kinds, in order
     * @param declaration the line emitted inside the {@code extern "C"} block
     */
    record Signature(String name, CType returns, List<CType> params, String declaration) {
        Signature {
            params = List.copyOf(params);
        }
    }

    private static final String VOID_PTR = "*mut std::ffi::c_void";

    private static final Map<String, Signature> FUNCTIONS = Stream.of(
            new Signature("malloc", CType.VOID_POINTER, List.of(CType.SIZE),
                    "fn malloc(size: usize) -> " + VOID_PTR + ";"),
            new Signature("calloc", CType.VOID_POINTER, List.of(CType.SIZE, CType.SIZE),
                    "fn calloc(count: usize, size: usize) -> " + VOID_PTR + ";"),
            new Signature("free", CType.VOID, List.of(CType.VOID_POINTER),
                    "fn free(ptr: " + VOID_PTR + ");"),
            new Signature("strlen", CType.SIZE, List.of(CType.CHAR_POINTER),
                    "fn strlen(s: *const u8) -> usize;"),
            new Signature("strcpy", CType.CHAR_POINTER, List.of(CType.CHAR_POINTER, CType.CHAR_POINTER),
                    "fn strcpy(dest: *mut u8, src: *const u8) -> *mut u8;"),
            new Signature("strncpy", CType.CHAR_POINTER,
                    List.of(CType.CHAR_POINTER, CType.CHAR_POINTER, CType.SIZE),
                    "fn strncpy(dest: *mut u8, src: *const u8, n: usize) -> *mut u8;"),
            new Signature("strcat", CType.CHAR_POINTER, List.of(CType.CHAR_POINTER, CType.CHAR_POINTER),
                    "fn strcat(dest: *mut u8, src: *const u8) -> *mut u8;"),
            new Signature("strcmp", CType.INT, List.of(CType.CHAR_POINTER, CType.CHAR_POINTER),
                    "fn strcmp(a: *const u8, b: *const u8) -> i32;"),
            new Signature("memset", CType.VOID_POINTER, List.of(CType.VOID_POINTER, CType.INT, CType.SIZE),
                    "fn memset(s: " + VOID_PTR + ", c: i32, n: usize) -> " + VOID_PTR + ";"),
            new Signature("memcpy", CType.VOID_POINTER,
                    List.of(CType.VOID_POINTER, CType.VOID_POINTER, CType.SIZE),
                    "fn memcpy(dest: " + VOID_PTR + ", src: *const std::ffi::c_void, n: usize) -> "
                            + VOID_PTR + ";"))
            .collect(Collectors.toUnmodifiableMap(Signature::name, Function.identity()));

    private LibcFunctions() {}

    static Optional<Signature> lookup(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    /**
     * Returns the extern declaration of a function recorded through
     * {@link CodegenContext#useExtern}.
     */
    static String declaration(String name) {
        Signature signature = FUNCTIONS.get(name);
        if (signature == null) {
            throw new IllegalStateException("No extern declaration for " + name);
        }
        return signature.declaration();
    }
}
