package io.surfworks.oxbow.verify;

import java.util.concurrent.TimeoutException;

/**
 * A process exited but one of its output pipes stayed open, usually because a
 * background child inherited it.
 */
public class OutputStillOpenException extends TimeoutException {

    private final String stream;

    public OutputStillOpenException(String stream, String message) {
        super(message);
        this.stream = stream;
    }

    /**
     * Returns "stdout" or "stderr".
     */
    public String stream() {
        return stream;
    }
}
