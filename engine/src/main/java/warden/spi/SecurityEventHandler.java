package warden.spi;

/**
 * SPI for handling security events raised by the engine.
 *
 * <p>Platform teams implement this interface to forward lockouts, new devices and
 * high-risk audit entries to their alerting systems. Implementations are discovered via
 * {@link java.util.ServiceLoader}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer metrics (priority 10)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.SecurityEventHandler}
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "pagerduty", "slack", "webhook")
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     *
     * @return true if the handler's dependencies are configured and reachable
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Exceptions thrown here are logged by the dispatcher and do not reach other handlers.
     *
     * @param event the security event to handle
     */
    void handle(SecurityEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
