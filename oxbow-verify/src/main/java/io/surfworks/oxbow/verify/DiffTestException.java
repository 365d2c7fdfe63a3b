package io.surfworks.oxbow.verify;

import java.util.Objects;

/**
 * Checked exception for infrastructure failures during a differential test.
 *
 * <p>A behavioral mismatch is never raised as an exception; it is a {@link DiffResult}
 * whose {@code passed()} is false.
 */
public class DiffTestException extends Exception {

    private final Side side;

    public DiffTestException(Side side, String message) {
        super(Objects.requireNonNull(side, "side cannot be null").label() + ": " + message);
        this.side = side;
    }

    public DiffTestException(Side side, String message, Throwable cause) {
        super(Objects.requireNonNull(side, "side cannot be null").label() + ": " + message, cause);
        this.side = side;
    }

    /**
     * Returns the side whose compile or run failed.
     */
    public Side side() {
        return side;
    }
}
