package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.config.SecurityEventsConfig;
import warden.spi.SecurityEvent;
import warden.spi.SecurityEventHandler;

@DisplayName("SecurityEventDispatcher")
class SecurityEventDispatcherTest {

    private static final SecurityEvent EVENT =
            new SecurityEvent.RateLimitExceeded(Instant.parse("2024-03-01T10:00:00Z"), "a@x.com", "login", 5, 5);

    private SecurityEventsConfig config;
    private SimpleMeterRegistry registry;
    private SecurityEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config = mock(SecurityEventsConfig.class);
        when(config.enabled()).thenReturn(true);
        registry = new SimpleMeterRegistry();
        dispatcher = new SecurityEventDispatcher(config, registry);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    @DisplayName("should order available handlers by priority, highest first")
    void shouldOrderHandlers() {
        final var unavailable = new RecordingHandler("offline", 100, false, null);

        dispatcher.init(List.of(
                new LoggingSecurityEventHandler(), unavailable, new MetricsSecurityEventHandler()));

        assertEquals(
                List.of("metrics", "logging"),
                dispatcher.getHandlers().stream().map(SecurityEventHandler::name).toList());
    }

    @Test
    @DisplayName("should deliver events to every handler even when one fails")
    void shouldIsolateHandlerFailures() throws InterruptedException {
        final var latch = new CountDownLatch(1);
        final var failing = new RecordingHandler("failing", 5, true, null) {
            @Override
            public void handle(SecurityEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        final var recording = new RecordingHandler("recording", 1, true, latch);
        dispatcher.init(List.of(failing, recording));

        dispatcher.publish(EVENT);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(EVENT), recording.received);
    }

    @Test
    @DisplayName("should wire the meter registry into the metrics handler")
    void shouldWireMetricsHandler() throws InterruptedException {
        final var latch = new CountDownLatch(1);
        dispatcher.init(List.of(new MetricsSecurityEventHandler(), new RecordingHandler("last", -1, true, latch)));

        dispatcher.publish(EVENT);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(1.0, registry.get("warden.ratelimit.denied").tag("scope", "login").counter().count());
    }

    @Test
    @DisplayName("should drop events when disabled")
    void shouldDropWhenDisabled() {
        when(config.enabled()).thenReturn(false);
        final var disabled = new SecurityEventDispatcher(config, registry);
        disabled.init();

        disabled.publish(EVENT);

        assertFalse(disabled.isEnabled());
        assertTrue(disabled.getHandlers().isEmpty());
    }

    @Test
    @DisplayName("should drop events raised after shutdown")
    void shouldDropAfterShutdown() {
        final var recording = new RecordingHandler("recording", 0, true, null);
        dispatcher.init(List.of(recording));
        dispatcher.shutdown();

        dispatcher.publish(EVENT);

        assertTrue(recording.received.isEmpty());
        assertTrue(recording.closed);
    }

    private static class RecordingHandler implements SecurityEventHandler {

        private final String name;
        private final int priority;
        private final boolean available;
        private final CountDownLatch latch;
        final List<SecurityEvent> received = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        RecordingHandler(String name, int priority, boolean available, CountDownLatch latch) {
            this.name = name;
            this.priority = priority;
            this.available = available;
            this.latch = latch;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public void handle(SecurityEvent event) {
            received.add(event);
            if (latch != null) {
                latch.countDown();
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
