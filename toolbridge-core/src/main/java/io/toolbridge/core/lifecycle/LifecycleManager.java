package io.toolbridge.core.lifecycle;

import io.toolbridge.core.discovery.SourceFailure;
import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.core.spi.ToolSourceRegistry;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-source sessions. Only sources whose client {@link ToolSourceClient#requiresSession() requires a
 * session} get one opened; every other source is served by a stateless handle.
 */
public final class LifecycleManager {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleManager.class);

    private final List<SourceDescriptor> sources;
    private final ToolSourceRegistry registry;
    private final boolean failOnSessionError;

    private final Map<SourceDescriptor, ToolSession> sessions = new IdentityHashMap<>();
    private final Map<SourceDescriptor, SourceFailure> openFailures = new IdentityHashMap<>();
    private boolean started;

    public LifecycleManager(List<SourceDescriptor> sources, ToolSourceRegistry registry, boolean failOnSessionError) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.failOnSessionError = failOnSessionError;
    }

    /**
     * Opens sessions for every session-bearing source. A second call while started is a no-op.
     *
     * @return the sources whose session could not be opened
     * @throws ToolAdapterException with {@link ErrorKind#LIFECYCLE_ERROR} in strict mode, after every session
     *                              opened so far has been closed again
     */
    public synchronized List<SourceFailure> start() {
        if (started) {
            LOG.debug("Lifecycle already started, {} live session(s)", sessions.size());
            return sessionFailures();
        }
        for (SourceDescriptor source : sources) {
            Optional<ToolSourceClient> client = registry.find(source.kind());
            if (client.isEmpty() || !client.get().requiresSession()) {
                continue;
            }
            try {
                sessions.put(source, client.get().openSession(source));
                LOG.debug("Opened session for source {}", source.name());
            } catch (ToolSourceException | RuntimeException e) {
                String message = "session could not be opened: " + e.getMessage();
                LOG.warn("Tool source {} ({}) {}", source.name(), source.kind().wireName(), message);
                openFailures.put(source, new SourceFailure(source, ErrorKind.SOURCE_UNREACHABLE, message));
                if (failOnSessionError) {
                    ToolAdapterException failure = ToolAdapterException.lifecycle(
                        "Could not open session for source " + source.name(), e);
                    for (SourceFailure closeFailure : releaseAll()) {
                        failure.addSuppressed(new IllegalStateException(closeFailure.sourceName() + ": " + closeFailure.message()));
                    }
                    throw failure;
                }
            }
        }
        started = true;
        return sessionFailures();
    }

    /**
     * Closes every open session, attempting all of them even when some fail. Safe to call when not started.
     *
     * @return one entry per session that failed to close
     */
    public synchronized List<SourceFailure> stop() {
        List<SourceFailure> failures = releaseAll();
        if (started) {
            LOG.debug("Lifecycle stopped with {} close failure(s)", failures.size());
        }
        started = false;
        return failures;
    }

    public synchronized boolean isStarted() {
        return started;
    }

    /**
     * @return the live session for {@code source}; empty when not started or when its session failed to open
     */
    public synchronized Optional<ToolSession> session(SourceDescriptor source) {
        if (!started || openFailures.containsKey(source)) {
            return Optional.empty();
        }
        ToolSession session = sessions.get(source);
        if (session != null) {
            return Optional.of(session);
        }
        boolean sessionBearing = registry.find(source.kind()).map(ToolSourceClient::requiresSession).orElse(false);
        return sessionBearing ? Optional.empty() : Optional.of(ToolSession.stateless(source));
    }

    public synchronized int liveSessions() {
        return sessions.size();
    }

    public List<SourceDescriptor> sources() {
        return sources;
    }

    /**
     * @return sources whose session failed to open during the current start, in configuration order
     */
    public synchronized List<SourceFailure> sessionFailures() {
        List<SourceFailure> failures = new ArrayList<>();
        for (SourceDescriptor source : sources) {
            SourceFailure failure = openFailures.get(source);
            if (failure != null) {
                failures.add(failure);
            }
        }
        return failures;
    }

    private List<SourceFailure> releaseAll() {
        Map<SourceDescriptor, ToolSession> open = new LinkedHashMap<>();
        for (SourceDescriptor source : sources) {
            ToolSession session = sessions.get(source);
            if (session != null) {
                open.put(source, session);
            }
        }
        List<SourceFailure> failures = new ArrayList<>();
        for (Map.Entry<SourceDescriptor, ToolSession> entry : open.entrySet()) {
            SourceDescriptor source = entry.getKey();
            try {
                registry.find(source.kind()).orElseThrow().closeSession(entry.getValue());
                LOG.debug("Closed session for source {}", source.name());
            } catch (ToolSourceException | RuntimeException e) {
                LOG.warn("Failed to close session for source {}: {}", source.name(), e.getMessage());
                failures.add(new SourceFailure(source, ErrorKind.LIFECYCLE_ERROR, e.getMessage()));
            }
        }
        sessions.clear();
        openFailures.clear();
        return failures;
    }
}
