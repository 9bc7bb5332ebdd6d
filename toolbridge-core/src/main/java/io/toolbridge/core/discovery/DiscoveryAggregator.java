package io.toolbridge.core.discovery;

import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.core.spi.ToolSourceRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queries every source concurrently and waits for all of them to settle. A failing source is recorded and
 * skipped; it never fails the pass.
 */
public final class DiscoveryAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryAggregator.class);
    private static final int MAX_THREADS = 16;
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final ToolSourceRegistry registry;

    public DiscoveryAggregator(ToolSourceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public DiscoveryResult discover(List<SourceDescriptor> sources, Function<SourceDescriptor, ToolSession> sessions)
        throws InterruptedException {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(sessions, "sessions must not be null");
        if (sources.isEmpty()) {
            return DiscoveryResult.empty();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(sources.size(), MAX_THREADS), daemonThreads());
        try {
            List<Callable<SourceOutcome>> tasks = new ArrayList<>(sources.size());
            for (SourceDescriptor source : sources) {
                tasks.add(() -> discoverOne(source, sessions));
            }
            List<Future<SourceOutcome>> futures = executor.invokeAll(tasks);

            List<RawTool> tools = new ArrayList<>();
            List<SourceFailure> failures = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                SourceOutcome outcome = outcomeOf(sources.get(i), futures.get(i));
                tools.addAll(outcome.tools());
                if (outcome.failure() != null) {
                    failures.add(outcome.failure());
                }
            }
            LOG.debug("Discovery settled: {} tool(s) from {} source(s), {} failure(s)",
                tools.size(), sources.size(), failures.size());
            return new DiscoveryResult(tools, failures);
        } finally {
            executor.shutdownNow();
        }
    }

    private SourceOutcome discoverOne(SourceDescriptor source, Function<SourceDescriptor, ToolSession> sessions) {
        Optional<ToolSourceClient> client = registry.find(source.kind());
        if (client.isEmpty()) {
            return failed(source, "No tool source client registered for protocol '" + source.kind().wireName() + "'");
        }
        try {
            List<RawTool> discovered = client.get().discover(source, sessions.apply(source));
            List<RawTool> tools = discovered == null ? List.of() : discovered;
            LOG.debug("Source {} reported {} tool(s)", source.name(), tools.size());
            return new SourceOutcome(tools, null);
        } catch (ToolSourceException e) {
            return failed(source, e.getMessage());
        } catch (RuntimeException e) {
            return failed(source, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private SourceOutcome outcomeOf(SourceDescriptor source, Future<SourceOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return failed(source, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private static SourceOutcome failed(SourceDescriptor source, String message) {
        LOG.warn("Tool source {} ({}) unreachable during discovery: {}", source.name(), source.kind().wireName(), message);
        return new SourceOutcome(List.of(), new SourceFailure(source, ErrorKind.SOURCE_UNREACHABLE, message));
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "toolbridge-discovery-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record SourceOutcome(List<RawTool> tools, SourceFailure failure) {
    }
}
