package io.surfworks.oxbow.verify;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Runs one external process to completion, capturing its output.
 *
 * <p>Standard output and standard error are drained on two short-lived reader threads
 * so a child that fills one pipe cannot block; the caller polls the process itself and
 * records its descendants while it runs. When the time limit passes, the process and
 * all of its descendants are destroyed forcibly and the runner waits for the process
 * to die before reporting the timeout. When the process exits but a pipe stays open,
 * the recorded descendants still alive are destroyed and the open stream is reported.
 * Output is captured as raw bytes.
 *
 * <p>The child gets no standard input.
 */
public final class ProcessRunner {

    private static final Logger LOG = Logger.getLogger(ProcessRunner.class.getName());

    /** How long to wait for the readers once the process has exited. */
    private static final long DRAIN_JOIN_MILLIS = 2_000;

    private static final long POLL_MILLIS = 50;

    private ProcessRunner() {
    }

    /**
     * Runs a command and waits for it.
     *
     * @param command   program and arguments
     * @param directory working directory
     * @param timeout   time limit
     * @return captured output and exit code
     * @throws IOException          if the process cannot be started or its output cannot be read
     * @throws TimeoutException     if the process outlived the limit; it has been killed
     * @throws OutputStillOpenException if the process exited but left a pipe open; its
     *                              surviving descendants have been killed
     * @throws InterruptedException if the calling thread was interrupted; the process has been killed
     */
    public static ExecutionOutput run(List<String> command, Path directory, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        Objects.requireNonNull(command, "command cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        if (directory != null) {
            pb.directory(directory.toFile());
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));

        LOG.fine(() -> "Starting " + String.join(" ", command));
        Process process = pb.start();

        StreamDrainer stdout = new StreamDrainer(process.getInputStream(), "oxbow-stdout-" + process.pid());
        StreamDrainer stderr = new StreamDrainer(process.getErrorStream(), "oxbow-stderr-" + process.pid());
        stdout.start();
        stderr.start();

        Set<ProcessHandle> descendants = new HashSet<>();
        boolean completed;
        try {
            completed = await(process, timeout, descendants);
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        if (!completed) {
            kill(process);
            LOG.fine(() -> String.format("Killed %s after %d ms", command.get(0), timeout.toMillis()));
            throw new TimeoutException("Process timed out after " + timeout.toMillis() + " ms: "
                    + String.join(" ", command));
        }

        stdout.join(DRAIN_JOIN_MILLIS);
        stderr.join(DRAIN_JOIN_MILLIS);
        if (stdout.isAlive() || stderr.isAlive()) {
            String stream = stdout.isAlive() ? "stdout" : "stderr";
            int killed = 0;
            for (ProcessHandle handle : descendants) {
                if (handle.isAlive() && handle.destroyForcibly()) {
                    killed++;
                }
            }
            int destroyed = killed;
            LOG.warning(() -> String.format("%s of %s still open %d ms after exit, destroyed %d descendant(s)",
                    stream, command.get(0), DRAIN_JOIN_MILLIS, destroyed));
            throw new OutputStillOpenException(stream, stream + " still open " + DRAIN_JOIN_MILLIS
                    + " ms after the process exited: " + String.join(" ", command));
        }
        int exitCode = process.exitValue();
        LOG.fine(() -> String.format("%s exited with %d", command.get(0), exitCode));
        return new ExecutionOutput(stdout.bytes(), stderr.bytes(), exitCode);
    }

    /**
     * Waits for the process in short slices, recording every descendant seen so that
     * children orphaned by the process can still be found after it exits.
     *
     * @return true if the process exited within the limit
     */
    private static boolean await(Process process, Duration timeout, Set<ProcessHandle> descendants)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            process.descendants().forEach(descendants::add);
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS));
            if (process.waitFor(slice, TimeUnit.NANOSECONDS)) {
                return true;
            }
        }
    }

    /**
     * Destroys the process tree and waits for the process to die.
     */
    private static void kill(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor();
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new File(windows ? "NUL" : "/dev/null");
    }

    private static final class StreamDrainer extends Thread {

        private final InputStream in;
        private volatile byte[] bytes = new byte[0];
        private volatile IOException failure;

        StreamDrainer(InputStream in, String name) {
            super(name);
            this.in = in;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream stream = in) {
                bytes = stream.readAllBytes();
            } catch (IOException e) {
                failure = e;
            }
        }

        byte[] bytes() throws IOException {
            if (failure != null) {
                throw failure;
            }
            return bytes;
        }
    }
}
