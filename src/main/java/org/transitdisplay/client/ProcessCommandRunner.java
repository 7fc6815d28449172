package org.transitdisplay.client;

import org.transitdisplay.interfaces.CommandRunner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands with {@link ProcessBuilder}; stderr is merged into the captured output.
 * <p>
 * Output is drained on a separate daemon thread so the timeout also applies to
 * commands that never close their output. A timed out or interrupted command is
 * killed.
 */
public final class ProcessCommandRunner implements CommandRunner {

    private final long timeoutSeconds;

    public ProcessCommandRunner(long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String run(List<String> command) throws IOException, InterruptedException {
        String label = String.join(" ", command);
        Process p = new ProcessBuilder(command).redirectErrorStream(true).start();

        FutureTask<String> output = new FutureTask<>(() -> {
            try (InputStream in = p.getInputStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        });
        Thread reader = new Thread(output, "process-output");
        reader.setDaemon(true);
        reader.start();

        try {
            if (!p.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                throw new IOException(label + " timed out after " + timeoutSeconds + " s");
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }

        String out;
        try {
            out = output.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("reading output of " + label + " failed", e.getCause());
        } catch (TimeoutException e) {
            // a child process still holds the output open
            throw new IOException(label + " exited but its output was not closed", e);
        }
        if (p.exitValue() != 0) {
            throw new IOException(label + " exited with " + p.exitValue() + ": " + out.trim());
        }
        return out;
    }
}
