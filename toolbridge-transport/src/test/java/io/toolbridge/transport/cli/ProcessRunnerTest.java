package io.toolbridge.transport.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.spi.ToolSourceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessRunnerTest {
    private static final int PIPE_FILLING_BYTES = 256 * 1024;

    private final ProcessRunner runner = new ProcessRunner();

    @TempDir
    Path tempDir;

    @Test
    void shouldDrainBothStreamsOfConcurrentChattyProcesses() throws Exception {
        String command = "head -c " + PIPE_FILLING_BYTES + " /dev/zero | tr '\\0' e >&2; "
            + "head -c " + PIPE_FILLING_BYTES + " /dev/zero | tr '\\0' o";
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ProcessResult>> runs = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                runs.add(() -> runner.run(command, null, Map.of(), Duration.ofSeconds(20)));
            }
            List<Future<ProcessResult>> results = executor.invokeAll(runs, 60, TimeUnit.SECONDS);

            for (Future<ProcessResult> future : results) {
                ProcessResult result = future.get();
                assertThat(result.succeeded()).isTrue();
                assertThat(result.stderr()).hasSize(PIPE_FILLING_BYTES);
                assertThat(result.stdout()).hasSize(PIPE_FILLING_BYTES);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldKillBackgroundChildrenOnTimeout() throws Exception {
        Path marker = tempDir.resolve("marker");
        String command = "(sleep 1; touch '" + marker + "') & wait";

        assertThatThrownBy(() -> runner.run(command, null, Map.of(), Duration.ofMillis(300)))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.TIMEOUT));

        Thread.sleep(1_500);
        assertThat(Files.exists(marker)).isFalse();
    }

    @Test
    void shouldReturnOutputWhenBackgroundChildKeepsPipeOpen() throws Exception {
        long startedAt = System.nanoTime();

        ProcessResult result = runner.run("echo ready; sleep 10 &", null, Map.of(), Duration.ofSeconds(5));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout()).isEqualTo("ready\n");
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt)).isLessThan(8_000L);
    }
}
