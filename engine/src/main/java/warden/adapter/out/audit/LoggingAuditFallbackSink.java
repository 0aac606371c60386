package warden.adapter.out.audit;

import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import warden.core.model.audit.AuditLogEntry;
import warden.core.port.out.AuditFallbackSink;

/**
 * Writes audit entries that could not be persisted as JSON lines to the
 * {@code warden.audit.fallback} log category.
 *
 * <p>Operators route that category to a dedicated file handler so entries can be
 * replayed once the repository is back.
 *
 * <p>A write that timed out may still complete in the repository, so such lines carry
 * {@code maybePersisted=true}. A replay must skip entries whose id is already stored.
 */
@ApplicationScoped
public class LoggingAuditFallbackSink implements AuditFallbackSink {

    static final String CATEGORY = "warden.audit.fallback";

    private static final Logger LOG = Logger.getLogger(CATEGORY);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final AtomicLong writes = new AtomicLong();
    private final Counter counter;

    @Inject
    public LoggingAuditFallbackSink(MeterRegistry meterRegistry) {
        this.counter = meterRegistry != null
                ? Counter.builder("warden.audit.fallback.writes")
                        .description("Audit entries written to the fallback log")
                        .register(meterRegistry)
                : null;
    }

    @Override
    public void write(AuditLogEntry entry, Throwable cause) {
        writes.incrementAndGet();
        if (counter != null) {
            counter.increment();
        }
        LOG.error(formatLine(entry, cause));
    }

    @Override
    public long writeCount() {
        return writes.get();
    }

    static String formatLine(AuditLogEntry entry, Throwable cause) {
        return String.format(
                "%s cause=\"%s\" maybePersisted=%s",
                toJson(entry),
                cause != null ? cause.getMessage() : "unknown",
                isTimeout(cause));
    }

    private static boolean isTimeout(Throwable cause) {
        return cause instanceof io.smallrye.mutiny.TimeoutException
                || cause instanceof java.util.concurrent.TimeoutException;
    }

    static String toJson(AuditLogEntry entry) {
        try {
            return OBJECT_MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            return String.format(
                    "{\"id\":\"%s\",\"eventType\":\"%s\",\"userId\":\"%s\",\"serializationError\":\"%s\"}",
                    entry.id(), entry.eventType(), entry.userId(), e.getOriginalMessage());
        }
    }
}
