package warden.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryAuditLogRepository;
import warden.adapter.out.storage.memory.InMemoryDeviceFingerprintRepository;
import warden.adapter.out.storage.memory.InMemoryRateLimitRecordStore;
import warden.adapter.out.storage.memory.InMemorySessionDirectory;
import warden.core.port.out.DeviceFingerprintRepository;
import warden.core.port.out.SessionDirectory;
import warden.spi.AuditLogRepository;
import warden.spi.RateLimitRecordStore;

/**
 * CDI producer for the storage ports.
 *
 * <p>Every port defaults to an in-memory implementation. Platform teams replace one by
 * providing their own bean of the port type, which takes precedence over these defaults.
 *
 * @see warden.spi.RateLimitRecordStore
 * @see warden.spi.AuditLogRepository
 */
@ApplicationScoped
public class StorageProducer {

    private static final Logger LOG = Logger.getLogger(StorageProducer.class);

    @Produces
    @DefaultBean
    @ApplicationScoped
    public RateLimitRecordStore rateLimitRecordStore() {
        return new InMemoryRateLimitRecordStore();
    }

    @Produces
    @DefaultBean
    @ApplicationScoped
    public AuditLogRepository auditLogRepository() {
        LOG.warn("Using in-memory audit log repository - entries are not durable");
        return new InMemoryAuditLogRepository();
    }

    @Produces
    @DefaultBean
    @ApplicationScoped
    public DeviceFingerprintRepository deviceFingerprintRepository() {
        return new InMemoryDeviceFingerprintRepository();
    }

    @Produces
    @DefaultBean
    @ApplicationScoped
    public SessionDirectory sessionDirectory(Clock clock) {
        return new InMemorySessionDirectory(clock);
    }
}
