package io.toolbridge.transport.cli;

import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.TransportErrors;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one shell command to completion. stdout and stderr are drained on two daemon threads per process, so a
 * chatty process cannot block on a full pipe. On timeout the whole process tree is killed.
 */
public final class ProcessRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();
    private static final long DRAIN_GRACE_MILLIS = 2_000L;

    public ProcessResult run(String command, Path workingDir, Map<String, String> env, Duration timeout)
        throws ToolSourceException {
        ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        builder.environment().putAll(env);

        Process process;
        try {
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw ToolSourceException.connection("Could not start command '" + command + "': " + e.getMessage(), e);
        }

        StreamDrain stdout = StreamDrain.start(process.getInputStream(), "stdout");
        StreamDrain stderr = StreamDrain.start(process.getErrorStream(), "stderr");
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                throw ToolSourceException.timeout("Command '" + command + "' timed out after " + timeout.toMillis() + " ms", null);
            }
            return new ProcessResult(process.exitValue(), stdout.await(command), stderr.await(command));
        } catch (InterruptedException e) {
            destroyTree(process);
            throw TransportErrors.interrupted("Command '" + command + "'", e);
        } catch (IOException e) {
            throw ToolSourceException.connection("Could not read output of '" + command + "': " + e.getMessage(), e);
        }
    }

    // Descendants first: once the shell is gone its children are reparented and no longer reachable from it.
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static final class StreamDrain {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;
        private volatile IOException failure;

        private StreamDrain(InputStream stream, String name) {
            this.thread = new Thread(() -> {
                try (stream) {
                    stream.transferTo(buffer);
                } catch (IOException e) {
                    failure = e;
                }
            }, "toolbridge-cli-" + name + "-" + THREAD_IDS.incrementAndGet());
            this.thread.setDaemon(true);
        }

        static StreamDrain start(InputStream stream, String name) {
            StreamDrain drain = new StreamDrain(stream, name);
            drain.thread.start();
            return drain;
        }

        /**
         * Waits briefly for end of stream after the process exited. A background child that inherited the pipe
         * keeps it open; its output so far is returned instead of waiting for it.
         */
        String await(String command) throws InterruptedException, IOException {
            thread.join(DRAIN_GRACE_MILLIS);
            if (thread.isAlive()) {
                LOG.debug("Output of '{}' still open after exit, returning what was read", command);
            } else if (failure != null) {
                throw failure;
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
