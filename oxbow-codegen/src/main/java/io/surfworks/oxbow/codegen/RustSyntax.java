package io.surfworks.oxbow.codegen;

import java.util.Set;
import java.util.regex.Pattern;

import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.PointerType;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.Type;

/**
 * Spelling of C types, names and constants in Rust.
 */
final class RustSyntax {

    static final String C_VOID = "std::ffi::c_void";
    static final String NULL_POINTER = "std::ptr::null_mut()";

    private static final Pattern SIMPLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*|[0-9][0-9A-Za-z_.]*");

    private static final Set<String> KEYWORDS = Set.of(
            "as", "async", "await", "box", "crate", "dyn", "fn", "impl", "in", "let", "loop",
            "match", "mod", "move", "mut", "pub", "ref", "self", "Self", "super", "trait",
            "type", "unsafe", "use", "where", "yield", "abstract", "become", "final", "macro",
            "override", "priv", "try", "typeof", "unsized", "virtual");

    private RustSyntax() {}

    /**
     * Renders a C type as the closest raw Rust type: int to i32, char to u8,
     * float to f32, T* to *mut T.
     */
    static String type(Type type) {
        if (type instanceof ScalarType s) {
            return switch (s.kind()) {
                case VOID -> "()";
                case INT -> "i32";
                case CHAR -> "u8";
                case FLOAT -> "f32";
            };
        }
        if (type instanceof PointerType p) {
            return "*mut " + pointee(p.pointee());
        }
        ArrayType a = (ArrayType) type;
        if (a.length().isPresent()) {
            return "[" + type(a.element()) + "; " + a.length().getAsInt() + "]";
        }
        return "*mut " + type(a.element());
    }

    /**
     * Renders the target of a pointer; {@code void} becomes {@code c_void}.
     */
    static String pointee(Type type) {
        return type.isVoid() ? C_VOID : type(type);
    }

    /**
     * Returns the value a C variable of this type is zero-initialized to.
     */
    static String zero(Type type) {
        if (type instanceof ScalarType s) {
            return switch (s.kind()) {
                case VOID -> "()";
                case INT -> "0i32";
                case CHAR -> "0u8";
                case FLOAT -> "0.0f32";
            };
        }
        if (type instanceof ArrayType a && a.length().isPresent()) {
            return "[" + zero(a.element()) + "; " + a.length().getAsInt() + "]";
        }
        return NULL_POINTER;
    }

    /**
     * Escapes C identifiers that are reserved words in Rust.
     */
    static String name(String name) {
        return KEYWORDS.contains(name) ? "r#" + name : name;
    }

    /**
     * True for identifiers and unsigned numeric literals, which need no parentheses
     * as operands.
     */
    static boolean isSimple(String text) {
        return SIMPLE.matcher(text).matches();
    }

    static String paren(String text) {
        return isSimple(text) ? text : "(" + text + ")";
    }

    /**
     * Renders {@code (text as target)}, omitting inner parentheses for simple operands.
     */
    static String cast(String text, String target) {
        return "(" + paren(text) + " as " + target + ")";
    }

    /**
     * Escapes text for a Rust string literal body.
     */
    static String escapeString(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            sb.append(escapeChar(text.charAt(i), '"'));
        }
        return sb.toString();
    }

    /**
     * Renders a C character constant as a Rust byte literal.
     */
    static String byteLiteral(char c) {
        if (c > 0x7f) {
            return (int) c + "u8";
        }
        return "b'" + escapeChar(c, '\'') + "'";
    }

    private static String escapeChar(char c, char quote) {
        switch (c) {
            case '\n':
                return "\\n";
            case '\t':
                return "\\t";
            case '\r':
                return "\\r";
            case '\\':
                return "\\\\";
            case '\0':
                return "\\0";
            default:
                if (c == quote) {
                    return "\\" + c;
                }
                if (c < 0x20 || c == 0x7f) {
                    return String.format("\\x%02x", (int) c);
                }
                return String.valueOf(c);
        }
    }
}
