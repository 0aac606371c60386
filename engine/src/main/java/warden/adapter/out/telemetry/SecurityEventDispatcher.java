package warden.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import warden.config.SecurityEventsConfig;
import warden.core.port.out.SecurityAlerting;
import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Dispatches security events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Events are dispatched on a single background thread so
 * rate limit checks and audit writes never wait on alerting.
 *
 * <p>When security events are disabled, events are silently dropped.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityAlerting {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    private List<SecurityEventHandler> handlers;
    private ExecutorService executor;

    @Inject
    public SecurityEventDispatcher(SecurityEventsConfig config, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security events are disabled - event dispatcher inactive");
            return;
        }

        var loadedHandlers = ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        init(loadedHandlers);
    }

    /**
     * Install handlers directly, bypassing {@link ServiceLoader}.
     *
     * @param loadedHandlers candidate handlers
     */
    void init(List<SecurityEventHandler> loadedHandlers) {
        for (var handler : loadedHandlers) {
            if (handler instanceof MetricsSecurityEventHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        handlers = loadedHandlers.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d security event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "security-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
                }
            });
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Dispatch a security event to all registered handlers.
     *
     * <p>Events are dispatched asynchronously. If security events are disabled,
     * this method is a no-op.
     *
     * @param event the event to dispatch
     */
    @Override
    public void publish(SecurityEvent event) {
        if (!enabled || handlers == null || handlers.isEmpty()) {
            return;
        }

        try {
            executor.submit(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropping %s raised during shutdown", event.getClass().getSimpleName());
        }
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
            }
        }
    }

    /**
     * Get the list of registered handlers.
     *
     * @return list of handlers (empty if disabled)
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }
}
