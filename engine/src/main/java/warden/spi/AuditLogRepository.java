package warden.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditQuery;

/**
 * SPI for the append-only audit table.
 *
 * <p>Entries are never deleted. Retention moves them to archived state through
 * {@link #archiveExpired}. Failures are reported as failed {@link Uni}s, typically
 * carrying a {@link StorageProviderException}.
 */
public interface AuditLogRepository {

    /**
     * Append an entry.
     *
     * @param entry the fully enriched entry
     * @return Uni completing when the entry is durable
     */
    Uni<Void> insert(AuditLogEntry entry);

    /**
     * Find entries matching the query, newest first, paged by the query's limit and offset.
     *
     * @param query filters and paging
     * @return Uni with the matching page
     */
    Uni<List<AuditLogEntry>> query(AuditQuery query);

    /**
     * Find a single entry.
     *
     * @param id entry id
     * @return Uni with the entry, if present
     */
    Uni<Optional<AuditLogEntry>> findById(String id);

    /**
     * Set the review fields of an entry. Last write wins.
     *
     * @param id       entry id
     * @param reviewer who reviewed the entry
     * @param notes    optional notes
     * @param at       review time
     * @return Uni with true if the entry exists
     */
    Uni<Boolean> updateReview(String id, String reviewer, String notes, Instant at);

    /**
     * Archive every non-archived entry whose retention ended before {@code now}.
     *
     * @param now current time
     * @return Uni with the number of archived entries
     */
    Uni<Integer> archiveExpired(Instant now);

    /**
     * Quick availability probe for health reporting.
     *
     * @return Uni with true when the repository accepts writes
     */
    default Uni<Boolean> isAvailable() {
        return Uni.createFrom().item(true);
    }
}
