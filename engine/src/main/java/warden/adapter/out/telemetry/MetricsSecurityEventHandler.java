package warden.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer metrics.
 *
 * <p>This is a built-in handler with priority 10.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.security.events.total} - Total events by type and severity</li>
 *   <li>{@code warden.ratelimit.denied} - Rate limit denials by scope</li>
 *   <li>{@code warden.security.lockouts} - Login lockouts</li>
 *   <li>{@code warden.security.new_devices} - New devices detected</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Set the meter registry.
     *
     * <p>Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("warden.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase())
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.RateLimitExceeded e) {
            Counter.builder("warden.ratelimit.denied")
                    .description("Requests denied by a rate limit scope")
                    .tag("scope", e.scope())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.AccountLocked) {
            Counter.builder("warden.security.lockouts")
                    .description("Login identifiers locked out")
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.NewDeviceDetected) {
            Counter.builder("warden.security.new_devices")
                    .description("Identifiers seen on an unknown device")
                    .register(registry)
                    .increment();
        }
    }
}
