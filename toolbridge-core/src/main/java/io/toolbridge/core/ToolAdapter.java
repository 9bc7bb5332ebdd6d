package io.toolbridge.core;

import io.toolbridge.core.catalog.CatalogBuildResult;
import io.toolbridge.core.catalog.CatalogBuilder;
import io.toolbridge.core.catalog.SchemaWarning;
import io.toolbridge.core.catalog.ToolCatalog;
import io.toolbridge.core.config.AdapterConfig;
import io.toolbridge.core.discovery.DiscoveryAggregator;
import io.toolbridge.core.discovery.DiscoveryResult;
import io.toolbridge.core.discovery.SourceFailure;
import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.invoke.InvocationDispatcher;
import io.toolbridge.core.lifecycle.LifecycleManager;
import io.toolbridge.core.model.AdaptedTool;
import io.toolbridge.core.naming.NameSanitizer;
import io.toolbridge.core.schema.SchemaNormalizer;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceRegistry;
import io.toolbridge.core.tool.AdaptedToolHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for host frameworks: aggregates the tools of every configured source into one catalog and
 * dispatches calls back to the right source.
 *
 * <pre>{@code
 * try (ToolAdapter adapter = ToolAdapter.create(config, registry).start()) {
 *     adapter.callTool("get_weather_forecast", Map.of("city", "Harare"));
 * }
 * }</pre>
 */
public final class ToolAdapter implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ToolAdapter.class);
    public static final int DEFAULT_SEARCH_LIMIT = 100;

    private final AdapterConfig config;
    private final LifecycleManager lifecycle;
    private final DiscoveryAggregator aggregator;
    private final CatalogBuilder catalogBuilder;
    private final InvocationDispatcher dispatcher;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public ToolAdapter(AdapterConfig config, ToolSourceRegistry registry, NameSanitizer sanitizer, SchemaNormalizer normalizer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        this.lifecycle = new LifecycleManager(config.sources(), registry, config.failOnSessionError());
        this.aggregator = new DiscoveryAggregator(registry);
        this.catalogBuilder = new CatalogBuilder(sanitizer, normalizer);
        this.dispatcher = new InvocationDispatcher(() -> snapshot.get().catalog(), lifecycle, registry);
    }

    public static ToolAdapter create(AdapterConfig config, ToolSourceRegistry registry) {
        return new ToolAdapter(config, registry, new NameSanitizer(), new SchemaNormalizer());
    }

    /**
     * Opens sessions and runs the first discovery pass. Calling it again while started does nothing.
     *
     * @throws ToolAdapterException {@link ErrorKind#LIFECYCLE_ERROR} when sessions cannot be set up in strict
     *                              mode or discovery cannot run; no session stays open in that case
     */
    public synchronized ToolAdapter start() {
        if (lifecycle.isStarted()) {
            return this;
        }
        try {
            lifecycle.start();
            discover();
        } catch (RuntimeException e) {
            List<SourceFailure> closeFailures = lifecycle.stop();
            snapshot.set(Snapshot.EMPTY);
            ToolAdapterException failure = e instanceof ToolAdapterException adapterError && adapterError.kind() == ErrorKind.LIFECYCLE_ERROR
                ? adapterError
                : ToolAdapterException.lifecycle("Tool adapter initialization failed: " + e.getMessage(), e);
            closeFailures.forEach(f -> failure.addSuppressed(new IllegalStateException(f.sourceName() + ": " + f.message())));
            throw failure;
        }
        Snapshot current = snapshot.get();
        LOG.info("Tool adapter started: {} tool(s) from {} source(s), {} unreachable",
            current.catalog().size(), config.sources().size(), current.failures().size());
        return this;
    }

    /**
     * Releases every session, even when some fail to close.
     *
     * @throws ToolAdapterException {@link ErrorKind#LIFECYCLE_ERROR} listing the sessions that failed to close
     */
    public synchronized void stop() {
        boolean wasStarted = lifecycle.isStarted();
        List<SourceFailure> failures = lifecycle.stop();
        snapshot.set(Snapshot.EMPTY);
        if (wasStarted) {
            LOG.info("Tool adapter stopped");
        }
        if (!failures.isEmpty()) {
            StringBuilder message = new StringBuilder("Failed to close ").append(failures.size()).append(" session(s):");
            failures.forEach(f -> message.append(' ').append(f.sourceName()).append(" (").append(f.message()).append(')'));
            throw new ToolAdapterException(ErrorKind.LIFECYCLE_ERROR, message.toString());
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs a new discovery pass over the live sessions and swaps the catalog in one step.
     */
    public synchronized ToolAdapter refresh() {
        requireStarted();
        try {
            discover();
        } catch (ToolAdapterException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ToolAdapterException.lifecycle("Tool catalog refresh failed: " + e.getMessage(), e);
        }
        LOG.info("Tool catalog refreshed: {} tool(s)", snapshot.get().catalog().size());
        return this;
    }

    public boolean isStarted() {
        return lifecycle.isStarted();
    }

    public List<AdaptedTool> listTools() {
        return catalog().list();
    }

    public Optional<AdaptedTool> getTool(String name) {
        return catalog().resolve(name);
    }

    public List<AdaptedTool> searchTools(String query) {
        return searchTools(query, DEFAULT_SEARCH_LIMIT);
    }

    public List<AdaptedTool> searchTools(String query, int maxResults) {
        return catalog().search(query, maxResults);
    }

    public Object callTool(String name, Map<String, Object> arguments) {
        return dispatcher.call(name, arguments);
    }

    public List<AdaptedToolHandle> toHostTools() {
        List<AdaptedToolHandle> handles = new ArrayList<>();
        for (AdaptedTool tool : catalog().list()) {
            handles.add(new AdaptedToolHandle(tool, this::callTool));
        }
        return handles;
    }

    public List<SourceFailure> discoveryFailures() {
        return snapshot.get().failures();
    }

    public List<SchemaWarning> schemaWarnings() {
        return snapshot.get().warnings();
    }

    public List<SourceDescriptor> sources() {
        return config.sources();
    }

    public int liveSessions() {
        return lifecycle.liveSessions();
    }

    ToolCatalog catalog() {
        return snapshot.get().catalog();
    }

    private void discover() {
        List<SourceDescriptor> reachable = new ArrayList<>();
        for (SourceDescriptor source : config.sources()) {
            if (lifecycle.session(source).isPresent()) {
                reachable.add(source);
            }
        }
        DiscoveryResult result;
        try {
            result = aggregator.discover(reachable, this::sessionFor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ToolAdapterException.lifecycle("Tool discovery interrupted", e);
        }
        CatalogBuildResult built = catalogBuilder.build(result.tools());

        List<SourceFailure> failures = new ArrayList<>(lifecycle.sessionFailures());
        failures.addAll(result.failures());
        snapshot.set(new Snapshot(built.catalog(), failures, built.warnings()));
    }

    private ToolSession sessionFor(SourceDescriptor source) {
        return lifecycle.session(source).orElseThrow(() -> new ToolAdapterException(
            ErrorKind.LIFECYCLE_ERROR, "No live session for source " + source.name()));
    }

    private void requireStarted() {
        if (!lifecycle.isStarted()) {
            throw new ToolAdapterException(ErrorKind.LIFECYCLE_ERROR, "Tool adapter not initialized; call start() first");
        }
    }

    private record Snapshot(ToolCatalog catalog, List<SourceFailure> failures, List<SchemaWarning> warnings) {
        static final Snapshot EMPTY = new Snapshot(ToolCatalog.empty(), List.of(), List.of());

        Snapshot {
            failures = List.copyOf(failures);
            warnings = List.copyOf(warnings);
        }
    }
}
