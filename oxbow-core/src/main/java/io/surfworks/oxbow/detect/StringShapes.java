package io.surfworks.oxbow.detect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.surfworks.oxbow.ir.IrAst.ArrayType;
import io.surfworks.oxbow.ir.IrAst.Call;
import io.surfworks.oxbow.ir.IrAst.Expr;
import io.surfworks.oxbow.ir.IrAst.Literal;
import io.surfworks.oxbow.ir.IrAst.LiteralKind;
import io.surfworks.oxbow.ir.IrAst.Scalar;
import io.surfworks.oxbow.ir.IrAst.ScalarType;
import io.surfworks.oxbow.ir.IrAst.Type;
import io.surfworks.oxbow.ir.IrAst.VarRef;

/**
 * Structural recognizers for C string handling: fixed char buffers and the libc calls
 * that fill or read them.
 */
public final class StringShapes {

    public static final String STRCPY = "strcpy";
    public static final String STRLEN = "strlen";
    public static final String PUTS = "puts";
    public static final String PRINTF = "printf";

    private StringShapes() {}

    /**
     * Returns the length of a {@code char buf[N]} type.
     */
    public static Optional<Integer> bufferLength(Type type) {
        if (type instanceof ArrayType a
                && a.element() instanceof ScalarType s
                && s.kind() == Scalar.CHAR
                && a.length().isPresent()) {
            return Optional.of(a.length().getAsInt());
        }
        return Optional.empty();
    }

    /**
     * Returns the destination variable of {@code strcpy(variable, source)}.
     */
    public static Optional<String> copyTarget(Expr expr) {
        if (expr instanceof Call call
                && call.calls(STRCPY)
                && call.args().size() == 2
                && call.args().get(0) instanceof VarRef target) {
            return Optional.of(target.name());
        }
        return Optional.empty();
    }

    /**
     * True for a string literal that fits, with its terminator, in {@code capacity} bytes.
     * Only ASCII text qualifies, so the byte length equals the character count.
     */
    public static boolean fitsLiteral(Expr expr, int capacity) {
        if (!(expr instanceof Literal lit) || lit.kind() != LiteralKind.STRING) {
            return false;
        }
        String text = lit.text();
        return text.length() < capacity && text.chars().allMatch(c -> c > 0 && c < 0x80);
    }

    /**
     * Returns the argument positions of a call that are only read as C strings:
     * the operand of {@code strlen} and {@code puts}, and the {@code %s} arguments of a
     * {@code printf} whose format is a literal.
     */
    public static List<Integer> stringArguments(Call call) {
        if ((call.calls(STRLEN) || call.calls(PUTS)) && call.args().size() == 1) {
            return List.of(0);
        }
        if (!call.calls(PRINTF)
                || call.args().isEmpty()
                || !(call.args().get(0) instanceof Literal fmt)
                || fmt.kind() != LiteralKind.STRING) {
            return List.of();
        }
        List<Integer> positions = new ArrayList<>();
        String format = fmt.text();
        int argument = 1;
        int i = 0;
        while (i < format.length()) {
            if (format.charAt(i++) != '%') {
                continue;
            }
            if (i < format.length() && format.charAt(i) == '%') {
                i++;
                continue;
            }
            while (i < format.length() && "-0123456789.lh".indexOf(format.charAt(i)) >= 0) {
                i++;
            }
            if (i < format.length() && format.charAt(i) == 's') {
                positions.add(argument);
            }
            argument++;
            i++;
        }
        return positions;
    }
}
