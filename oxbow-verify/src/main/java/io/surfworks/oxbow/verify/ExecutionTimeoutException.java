package io.surfworks.oxbow.verify;

import java.time.Duration;
import java.util.List;

/**
 * An external process outlived its time limit, or exited with its output still held
 * open, and was killed.
 */
public class ExecutionTimeoutException extends DiffTestException {

    private final List<String> command;
    private final Duration timeout;

    public ExecutionTimeoutException(Side side, List<String> command, Duration timeout, Throwable cause) {
        this(side, command, timeout,
                "Timed out after " + timeout.toMillis() + " ms: " + String.join(" ", command), cause);
    }

    /**
     * Reports a process that did not finish cleanly within its limit for a reason
     * other than running too long, such as output left open by a background child.
     */
    public ExecutionTimeoutException(Side side, List<String> command, Duration timeout, String message,
                                     Throwable cause) {
        super(side, message, cause);
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public List<String> command() {
        return command;
    }

    public Duration timeout() {
        return timeout;
    }
}
