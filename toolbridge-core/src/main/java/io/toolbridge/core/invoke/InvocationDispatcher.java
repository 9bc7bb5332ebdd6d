package io.toolbridge.core.invoke;

import io.toolbridge.core.catalog.ToolCatalog;
import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.lifecycle.LifecycleManager;
import io.toolbridge.core.model.AdaptedTool;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.core.spi.ToolSourceRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a call by adapted name to the client of the tool's source. Arguments are forwarded as given;
 * validating them against the tool schema is the caller's job.
 */
public final class InvocationDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(InvocationDispatcher.class);

    private final Supplier<ToolCatalog> catalog;
    private final LifecycleManager lifecycle;
    private final ToolSourceRegistry registry;

    public InvocationDispatcher(Supplier<ToolCatalog> catalog, LifecycleManager lifecycle, ToolSourceRegistry registry) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public Object call(String name, Map<String, Object> arguments) {
        if (!lifecycle.isStarted()) {
            throw new ToolAdapterException(ErrorKind.LIFECYCLE_ERROR, "Tool adapter not initialized; call start() first");
        }
        AdaptedTool tool = catalog.get().resolve(name).orElseThrow(() -> ToolAdapterException.toolNotFound(name));
        SourceDescriptor source = tool.source();
        ToolSession session = lifecycle.session(source).orElseThrow(() -> new ToolAdapterException(
            ErrorKind.LIFECYCLE_ERROR, "No live session for source " + source.name()));
        ToolSourceClient client = registry.find(source.kind()).orElseThrow(() -> new ToolAdapterException(
            ErrorKind.LIFECYCLE_ERROR, "No tool source client registered for protocol '" + source.kind().wireName() + "'"));

        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        long startedAt = System.nanoTime();
        LOG.debug("Calling tool {} ({}) on source {}", tool.adaptedName(), tool.rawTool().rawName(), source.name());
        try {
            Object result = client.invoke(source, session, tool.rawTool(), args);
            LOG.debug("Tool {} completed in {} ms", tool.adaptedName(), elapsedMillis(startedAt));
            return result;
        } catch (ToolSourceException e) {
            LOG.debug("Tool {} failed after {} ms: {} {}", tool.adaptedName(), elapsedMillis(startedAt), e.failure(), e.getMessage());
            throw ToolAdapterException.invocationFailed(e.failure(),
                "Tool " + tool.adaptedName() + " failed: " + e.getMessage(), e);
        } catch (ToolAdapterException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ToolAdapterException.invocationFailed(InvocationFailure.UNKNOWN,
                "Tool " + tool.adaptedName() + " failed: " + e.getMessage(), e);
        }
    }

    private static long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000L;
    }
}
