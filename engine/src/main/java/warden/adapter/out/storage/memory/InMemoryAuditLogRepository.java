package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditQuery;
import warden.spi.AuditLogRepository;

/**
 * In-memory implementation of AuditLogRepository.
 *
 * <p>
 * Intended for development and testing. Entries are lost on restart.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAuditLogRepository.class);

    private static final Comparator<AuditLogEntry> NEWEST_FIRST = Comparator.comparing(
                    AuditLogEntry::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .reversed();

    private final ConcurrentMap<String, AuditLogEntry> entries = new ConcurrentHashMap<>();

    public InMemoryAuditLogRepository() {
        LOG.info("Initialized in-memory audit log repository");
    }

    @Override
    public Uni<Void> insert(AuditLogEntry entry) {
        return Uni.createFrom().item(() -> {
            if (entries.putIfAbsent(entry.id(), entry) != null) {
                LOG.warnf("Duplicate audit entry id %s ignored", entry.id());
            }
            return null;
        });
    }

    @Override
    public Uni<List<AuditLogEntry>> query(AuditQuery query) {
        return Uni.createFrom().item(() -> entries.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .skip(query.offset())
                .limit(query.limit())
                .toList());
    }

    @Override
    public Uni<Optional<AuditLogEntry>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(entries.get(id)));
    }

    @Override
    public Uni<Boolean> updateReview(String id, String reviewer, String notes, Instant at) {
        return Uni.createFrom()
                .item(() -> entries.computeIfPresent(id, (k, entry) -> entry.withReview(reviewer, notes, at)) != null);
    }

    @Override
    public Uni<Integer> archiveExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            final var archived = new AtomicInteger();
            for (final var id : entries.keySet()) {
                entries.computeIfPresent(id, (k, entry) -> {
                    if (!entry.archived() && entry.isExpired(now)) {
                        archived.incrementAndGet();
                        return entry.asArchived();
                    }
                    return entry;
                });
            }
            return archived.get();
        });
    }

    /**
     * Number of stored entries (for testing).
     */
    public int size() {
        return entries.size();
    }
}
