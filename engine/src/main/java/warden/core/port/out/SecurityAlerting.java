package warden.core.port.out;

import warden.spi.SecurityEvent;

/**
 * Port for raising security events without blocking the caller.
 */
public interface SecurityAlerting {

    /**
     * Check if security events are dispatched at all.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Hand an event to the registered handlers. Returns immediately.
     *
     * @param event the event to publish
     */
    void publish(SecurityEvent event);
}
