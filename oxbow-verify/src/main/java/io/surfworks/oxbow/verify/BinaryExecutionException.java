package io.surfworks.oxbow.verify;

import java.nio.file.Path;

/**
 * A compiled binary could not be started.
 */
public class BinaryExecutionException extends DiffTestException {

    private final Path binary;

    public BinaryExecutionException(Side side, Path binary, Throwable cause) {
        super(side, "Failed to execute binary " + binary + ": " + cause.getMessage(), cause);
        this.binary = binary;
    }

    public Path binary() {
        return binary;
    }
}
