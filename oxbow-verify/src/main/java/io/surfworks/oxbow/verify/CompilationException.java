package io.surfworks.oxbow.verify;

/**
 * A compiler rejected its source, or could not be started at all.
 */
public class CompilationException extends DiffTestException {

    private final String compiler;
    private final String diagnostics;

    public CompilationException(Side side, String compiler, String diagnostics) {
        super(side, compiler + " compilation failed:\n" + diagnostics);
        this.compiler = compiler;
        this.diagnostics = diagnostics;
    }

    public CompilationException(Side side, String compiler, String diagnostics, Throwable cause) {
        super(side, compiler + " compilation failed:\n" + diagnostics, cause);
        this.compiler = compiler;
        this.diagnostics = diagnostics;
    }

    public String compiler() {
        return compiler;
    }

    /** Compiler output, or the reason it could not be started. */
    public String diagnostics() {
        return diagnostics;
    }
}
