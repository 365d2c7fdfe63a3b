package io.surfworks.oxbow.codegen;

/**
 * Exception thrown when IR cannot be rendered as Rust.
 *
 * <p>The message names the offending construct. No partial output accompanies it.
 */
public class CodegenException extends Exception {

    public CodegenException(String message) {
        super(message);
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
