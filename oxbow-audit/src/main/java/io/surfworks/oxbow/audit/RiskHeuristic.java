package io.surfworks.oxbow.audit;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;

import io.surfworks.oxbow.audit.syntax.RustParser;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.Token;
import io.surfworks.oxbow.audit.syntax.RustTokenizer.TokenType;

/**
 * One entry of the ordered triage table used to classify unsafe regions.
 *
 * <p>Classification is deliberate heuristic triage over the region's tokens, not
 * semantic analysis: the first heuristic whose marker appears in the region wins.
 * Confidence estimates how likely the region can be rewritten without {@code unsafe};
 * pointer idioms score highest because a safe equivalent almost always exists,
 * inline assembly lowest because none does.
 *
 * @param kind        the classification
 * @param confidence  elimination confidence, 0 to 100
 * @param remediation suggested rewrite
 * @param marker      tests the region's tokens, given the file's declared symbols
 */
public record RiskHeuristic(
        RiskKind kind,
        int confidence,
        String remediation,
        BiPredicate<List<Token>, FileSymbols> marker
) {

    /** Catch-all for regions no other marker matches. */
    public static final RiskHeuristic UNCLASSIFIED = new RiskHeuristic(RiskKind.OTHER, 50,
            "Review manually and document the invariant in a SAFETY comment",
            (tokens, symbols) -> true);

    /** The standard table, in priority order. The last entry matches everything. */
    public static final List<RiskHeuristic> STANDARD = List.of(
            new RiskHeuristic(RiskKind.RAW_POINTER_DEREF, 85,
                    "Replace the raw pointer with a reference, Box<T> or Vec<T>; use Option<Box<T>> for nullable pointers",
                    (tokens, symbols) -> hasPointerMarker(tokens)),
            new RiskHeuristic(RiskKind.TRANSMUTE, 40,
                    "Use a checked conversion such as From/Into, to_bits/from_bits or to_ne_bytes instead of transmute",
                    (tokens, symbols) -> hasIdentifier(tokens, Set.of("transmute"))),
            new RiskHeuristic(RiskKind.INLINE_ASSEMBLY, 15,
                    "No safe equivalent; keep the assembly behind a minimal, documented wrapper",
                    (tokens, symbols) -> hasMacro(tokens, Set.of("asm", "global_asm"))),
            new RiskHeuristic(RiskKind.FFI_CALL, 30,
                    "Wrap the foreign call in a safe function that validates its arguments and results",
                    RiskHeuristic::hasForeignCall),
            new RiskHeuristic(RiskKind.UNION_OR_MUTABLE_GLOBAL, 60,
                    "Replace static mut with an atomic, Mutex or OnceLock, and unions with an enum",
                    (tokens, symbols) -> hasIdentifier(tokens, symbols.mutableStatics())
                            || hasIdentifier(tokens, symbols.unions())),
            UNCLASSIFIED);

    public RiskHeuristic {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(remediation, "remediation cannot be null");
        Objects.requireNonNull(marker, "marker cannot be null");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100: " + confidence);
        }
    }

    public boolean matches(List<Token> tokens, FileSymbols symbols) {
        return marker.test(tokens, symbols);
    }

    // ==================== Markers ====================

    /**
     * Unary {@code *} (dereference, or a raw pointer type after {@code as}),
     * {@code .is_null()}, {@code ptr::null} / {@code ptr::null_mut},
     * {@code .add(} and {@code .offset(}.
     */
    static boolean hasPointerMarker(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            Token prev = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (t.isPunct("*") && next != null && (prev == null || !endsOperand(prev))
                    && (next.type() == TokenType.IDENTIFIER || next.type() == TokenType.LPAREN
                        || next.isPunct("*"))) {
                return true;
            }
            if (t.type() != TokenType.IDENTIFIER || prev == null) {
                continue;
            }
            if (prev.isPunct(".") && t.value().equals("is_null")) {
                return true;
            }
            if (prev.isPunct(".") && (t.value().equals("add") || t.value().equals("offset"))
                    && next != null && next.type() == TokenType.LPAREN) {
                return true;
            }
            if (prev.isPunct("::") && (t.value().equals("null") || t.value().equals("null_mut"))
                    && i >= 2 && tokens.get(i - 2).isIdentifier("ptr")) {
                return true;
            }
        }
        return false;
    }

    private static boolean endsOperand(Token t) {
        return switch (t.type()) {
            case INTEGER, FLOAT, STRING, CHAR, RPAREN, RBRACKET, RBRACE -> true;
            case IDENTIFIER -> !RustParser.isReserved(t.value());
            default -> false;
        };
    }

    static boolean hasIdentifier(List<Token> tokens, Set<String> names) {
        if (names.isEmpty()) {
            return false;
        }
        for (Token t : tokens) {
            if (t.type() == TokenType.IDENTIFIER && names.contains(t.value())) {
                return true;
            }
        }
        return false;
    }

    static boolean hasMacro(List<Token> tokens, Set<String> names) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.IDENTIFIER && names.contains(t.value()) && tokens.get(i + 1).isPunct("!")) {
                return true;
            }
        }
        return false;
    }

    /**
     * A call to a function declared in an {@code extern} block, or a {@code libc::} / {@code ffi::} path.
     */
    static boolean hasForeignCall(List<Token> tokens, FileSymbols symbols) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token t = tokens.get(i);
            Token next = tokens.get(i + 1);
            if (t.type() != TokenType.IDENTIFIER) {
                continue;
            }
            if ((t.value().equals("libc") || t.value().equals("ffi")) && next.isPunct("::")) {
                return true;
            }
            boolean method = i > 0 && tokens.get(i - 1).isPunct(".");
            if (!method && next.type() == TokenType.LPAREN && symbols.externFunctions().contains(t.value())) {
                return true;
            }
        }
        return false;
    }
}
