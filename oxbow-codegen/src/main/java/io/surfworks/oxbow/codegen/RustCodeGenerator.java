package io.surfworks.oxbow.codegen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.oxbow.detect.RewriteCandidate;
import io.surfworks.oxbow.ir.IrAst.Function;
import io.surfworks.oxbow.ir.IrAst.Program;

/**
 * Generates Rust source from the C intermediate representation.
 *
 * <p>{@link #generate} produces a literal translation: every C pointer stays a raw
 * pointer and every memory access through one sits in its own {@code unsafe} block.
 * {@link #generateUpgraded} additionally replaces the declarations named by rewrite
 * candidates with owning types ({@code Box}, {@code Vec}, {@code Option<Box>},
 * {@code String}) and drops the matching {@code free} calls.
 *
 * <p>Function mode emits only the function text. Program mode emits a compilable
 * crate: a lint header, the {@code extern "C"} block for the C library functions
 * actually called, and every function in order.
 *
 * <p>The generator holds no state; output is a pure function of its input and is
 * produced only when the whole unit translates. Malformed input raises a
 * {@link CodegenException} and yields no partial text.
 *
 * <p>Example usage:
 * <pre>{@code
 * RustCodeGenerator generator = new RustCodeGenerator();
 * List<RewriteCandidate> candidates = new PatternDetector().detect(function);
 * String rust = generator.generateUpgraded(function, candidates);
 * }</pre>
 */
public final class RustCodeGenerator {

    private static final Logger LOG = Logger.getLogger(RustCodeGenerator.class.getName());

    static final String LINT_HEADER =
            "#![allow(unused_mut, unused_parens, unused_unsafe, unused_labels, unused_variables)]\n";

    /**
     * Translates a function literally.
     *
     * @param func the function to translate
     * @return Rust source text for the function
     * @throws CodegenException if the function cannot be translated
     */
    public String generate(Function func) throws CodegenException {
        return generateUpgraded(func, List.of());
    }

    /**
     * Translates a function, upgrading the given candidates to owning types.
     * With no candidates the output equals {@link #generate}.
     *
     * @param func       the function to translate
     * @param candidates candidates produced by the pattern detector for this function
     * @return Rust source text for the function
     * @throws CodegenException if the function or a candidate is malformed
     */
    public String generateUpgraded(Function func, List<RewriteCandidate> candidates) throws CodegenException {
        Objects.requireNonNull(func, "func cannot be null");
        Objects.requireNonNull(candidates, "candidates cannot be null");

        RustEmitter emitter = new RustEmitter(new CodegenContext(Map.of(func.name(), func)));
        emitter.emitFunction(func, candidates);
        String text = emitter.text();
        LOG.fine(() -> String.format("%s: generated %d line(s), %d upgrade(s)",
                func.name(), text.split("\n").length, candidates.size()));
        return text;
    }

    /**
     * Translates a whole program literally into a compilable crate.
     */
    public String generateProgram(Program program) throws CodegenException {
        return generateProgramUpgraded(program, Map.of());
    }

    /**
     * Translates a whole program into a compilable crate.
     *
     * @param program    the program to translate
     * @param candidates rewrite candidates keyed by function name; functions without an entry are
     *                   translated literally
     * @return Rust crate source
     * @throws CodegenException if any function or candidate is malformed
     */
    public String generateProgramUpgraded(Program program, Map<String, List<RewriteCandidate>> candidates)
            throws CodegenException {
        Objects.requireNonNull(program, "program cannot be null");
        Objects.requireNonNull(candidates, "candidates cannot be null");

        Map<String, Function> signatures = new LinkedHashMap<>();
        for (Function func : program.functions()) {
            if (signatures.put(func.name(), func) != null) {
                throw new CodegenException("Duplicate function: " + func.name());
            }
        }
        for (String name : candidates.keySet()) {
            if (program.function(name).isEmpty()) {
                throw new CodegenException("Rewrite candidates given for unknown function: " + name);
            }
        }

        CodegenContext ctx = new CodegenContext(signatures);
        RustEmitter emitter = new RustEmitter(ctx);
        boolean first = true;
        for (Function func : program.functions()) {
            if (!first) {
                emitter.blankLine();
            }
            first = false;
            emitter.emitFunction(func, candidates.getOrDefault(func.name(), List.of()));
        }

        StringBuilder sb = new StringBuilder(LINT_HEADER).append('\n');
        if (!ctx.externs().isEmpty()) {
            sb.append("extern \"C\" {\n");
            for (String name : ctx.externs()) {
                sb.append("    ").append(LibcFunctions.declaration(name)).append('\n');
            }
            sb.append("}\n\n");
        }
        sb.append(emitter.text());

        LOG.fine(() -> String.format("Generated crate with %d function(s), externs=%s",
                program.functions().size(), ctx.externs()));
        return sb.toString();
    }
}
