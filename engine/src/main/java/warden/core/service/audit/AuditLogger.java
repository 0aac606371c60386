package warden.core.service.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AuditConfig;
import warden.core.model.RiskLevel;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditQuery;
import warden.core.model.audit.AuditResult;
import warden.core.model.audit.AuditSinkHealth;
import warden.core.model.audit.AuditStats;
import warden.core.model.audit.AuditTimeframe;
import warden.core.port.in.AuditTrail;
import warden.core.port.out.AuditFallbackSink;
import warden.core.port.out.SecurityAlerting;
import warden.spi.AuditLogRepository;
import warden.spi.SecurityEvent;

/**
 * Append-only audit trail with risk classification and review workflow.
 *
 * <p>
 * {@link #logEvent} enriches the entry on the caller's thread and hands persistence to a
 * single writer thread, so entries reach the repository in the order they were logged. A
 * write that fails or exceeds {@link AuditConfig#writeTimeout()} goes to the
 * {@link AuditFallbackSink} and marks the sink degraded until the next successful write.
 * Entries are never dropped.
 *
 * <p>
 * Entries classified HIGH or CRITICAL raise a security event.
 */
@ApplicationScoped
public class AuditLogger implements AuditTrail {

    private static final Logger LOG = Logger.getLogger(AuditLogger.class);

    private final AuditConfig config;
    private final AuditLogRepository repository;
    private final AuditFallbackSink fallbackSink;
    private final SecurityAlerting alerting;
    private final Clock clock;
    private final Executor writer;
    private final ExecutorService ownedWriter;

    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final AtomicInteger pendingWrites = new AtomicInteger();
    private volatile Instant lastFailureAt;
    private volatile String lastFailureReason;

    @Inject
    public AuditLogger(
            AuditConfig config,
            AuditLogRepository repository,
            AuditFallbackSink fallbackSink,
            SecurityAlerting alerting,
            Clock clock) {
        this(config, repository, fallbackSink, alerting, clock, null);
    }

    /**
     * Create a logger persisting on the given executor. With a null executor a single
     * daemon writer thread is created and owned by the logger.
     */
    AuditLogger(
            AuditConfig config,
            AuditLogRepository repository,
            AuditFallbackSink fallbackSink,
            SecurityAlerting alerting,
            Clock clock,
            Executor writer) {
        this.config = config;
        this.repository = repository;
        this.fallbackSink = fallbackSink;
        this.alerting = alerting;
        this.clock = clock;
        if (writer != null) {
            this.writer = writer;
            this.ownedWriter = null;
        } else {
            this.ownedWriter = Executors.newSingleThreadExecutor(r -> {
                final var thread = new Thread(r, "audit-writer");
                thread.setDaemon(true);
                return thread;
            });
            this.writer = ownedWriter;
        }
    }

    @PreDestroy
    void shutdown() {
        if (ownedWriter == null) {
            return;
        }
        ownedWriter.shutdown();
        try {
            if (!ownedWriter.awaitTermination(config.writeTimeout().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                LOG.warnf("Audit writer did not drain, %d entries pending", pendingWrites.get());
                ownedWriter.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedWriter.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public AuditLogEntry logEvent(AuditLogEntry entry) {
        final var enriched = enrich(entry);

        pendingWrites.incrementAndGet();
        try {
            writer.execute(() -> persist(enriched));
        } catch (RejectedExecutionException e) {
            pendingWrites.decrementAndGet();
            fallback(enriched, e);
        }

        if (enriched.riskLevel().isElevated() && config.alertOnHighRisk()) {
            alerting.publish(new SecurityEvent.HighRiskAuditEvent(
                    enriched.createdAt(),
                    enriched.userId(),
                    enriched.id(),
                    enriched.eventType().name(),
                    enriched.riskLevel().name()));
        }
        return enriched;
    }

    AuditLogEntry enrich(AuditLogEntry entry) {
        final var now = clock.instant();
        final var riskLevel = entry.riskLevel() != null ? entry.riskLevel() : AuditRiskClassifier.riskLevel(entry);
        final var confidence = entry.confidenceScore() != null
                ? Math.max(0.0, Math.min(1.0, entry.confidenceScore()))
                : AuditRiskClassifier.confidence(entry);
        final var requiresReview = entry.requiresReview() != null
                ? entry.requiresReview()
                : AuditRiskClassifier.requiresReview(entry, riskLevel);
        final var createdAt = entry.createdAt() != null ? entry.createdAt() : now;
        return entry.enrich(
                entry.id() != null ? entry.id() : UUID.randomUUID().toString(),
                createdAt,
                entry.expiresAt() != null ? entry.expiresAt() : createdAt.plus(config.retention()),
                riskLevel,
                confidence,
                requiresReview);
    }

    private void persist(AuditLogEntry entry) {
        try {
            repository.insert(entry).await().atMost(config.writeTimeout());
            if (degraded.compareAndSet(true, false)) {
                LOG.info("Audit persistence recovered");
            }
        } catch (RuntimeException e) {
            fallback(entry, e);
        } finally {
            pendingWrites.decrementAndGet();
        }
    }

    private void fallback(AuditLogEntry entry, Throwable cause) {
        fallbackSink.write(entry, cause);
        lastFailureAt = clock.instant();
        lastFailureReason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (degraded.compareAndSet(false, true)) {
            LOG.errorf(cause, "Audit persistence failed, writing to fallback log");
            alerting.publish(new SecurityEvent.AuditSinkDegraded(lastFailureAt, "audit-sink", lastFailureReason));
        }
    }

    @Override
    public Uni<List<AuditLogEntry>> queryLogs(AuditQuery query) {
        return repository
                .query(query != null ? query : AuditQuery.all())
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Audit query failed: %s", e.getMessage());
                    return List.of();
                });
    }

    @Override
    public Uni<Boolean> markAsReviewed(String id, String reviewer, String notes) {
        if (reviewer == null || reviewer.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Reviewer cannot be blank"));
        }
        return repository
                .updateReview(id, reviewer, notes, clock.instant())
                .invoke(updated -> {
                    if (updated) {
                        LOG.debugf("Audit entry %s reviewed by %s", id, reviewer);
                    }
                })
                .onFailure(e -> !(e instanceof IllegalArgumentException))
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to mark audit entry %s as reviewed: %s", id, e.getMessage());
                    return false;
                });
    }

    /**
     * Record the outcome of a permission check.
     */
    public AuditLogEntry logPermissionCheck(
            String userId, String permission, boolean granted, String reason, String organizationId) {
        return logEvent(AuditLogEntry.builder(AuditEventType.PERMISSION_CHECK)
                .result(granted ? AuditResult.SUCCESS : AuditResult.DENIED)
                .userId(userId)
                .organizationId(organizationId)
                .action("check_permission")
                .reason(reason)
                .metadata(new AuditMetadata.PermissionCheck(permission, granted, reason))
                .build());
    }

    /**
     * Record a role assignment or removal. Removals pass a null {@code roleTo}.
     */
    public AuditLogEntry logRoleAssignment(
            String actorId, String targetUserId, String roleFrom, String roleTo, String organizationId) {
        final var eventType = roleTo != null ? AuditEventType.ROLE_ASSIGNED : AuditEventType.ROLE_REMOVED;
        return logEvent(AuditLogEntry.builder(eventType)
                .userId(actorId)
                .targetUserId(targetUserId)
                .organizationId(organizationId)
                .resource("role", roleTo != null ? roleTo : roleFrom)
                .action(roleTo != null ? "assign_role" : "remove_role")
                .metadata(new AuditMetadata.RoleChange(roleFrom, roleTo, actorId))
                .build());
    }

    /**
     * Record an access decision on a resource.
     */
    public AuditLogEntry logAccessEvent(
            String userId,
            boolean granted,
            String resourceType,
            String resourceId,
            String method,
            String path,
            int statusCode) {
        return logEvent(AuditLogEntry.builder(granted ? AuditEventType.ACCESS_GRANTED : AuditEventType.ACCESS_DENIED)
                .result(granted ? AuditResult.SUCCESS : AuditResult.DENIED)
                .userId(userId)
                .resource(resourceType, resourceId)
                .requestPath(path)
                .action(method)
                .metadata(new AuditMetadata.Access(method, path, statusCode))
                .build());
    }

    /**
     * Counts over the entries logged within the timeframe.
     */
    public Uni<AuditStats> getAuditStats(AuditTimeframe timeframe) {
        final var since = clock.instant().minus(timeframe.lookBack());
        return repository
                .query(AuditQuery.all().since(since).page(Integer.MAX_VALUE, 0))
                .map(entries -> stats(timeframe, entries))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Audit stats query failed: %s", e.getMessage());
                    return stats(timeframe, List.of());
                });
    }

    private static AuditStats stats(AuditTimeframe timeframe, List<AuditLogEntry> entries) {
        final var byType = new EnumMap<AuditEventType, Integer>(AuditEventType.class);
        final var byRisk = new EnumMap<RiskLevel, Integer>(RiskLevel.class);
        var failed = 0;
        var pendingReview = 0;
        var highRisk = 0;
        for (final var entry : entries) {
            byType.merge(entry.eventType(), 1, Integer::sum);
            if (entry.riskLevel() != null) {
                byRisk.merge(entry.riskLevel(), 1, Integer::sum);
                if (entry.riskLevel().isElevated()) {
                    highRisk++;
                }
            }
            if (entry.result().isFailure()) {
                failed++;
            }
            if (Boolean.TRUE.equals(entry.requiresReview())) {
                pendingReview++;
            }
        }
        return new AuditStats(timeframe, entries.size(), byType, byRisk, failed, pendingReview, highRisk);
    }

    /**
     * Archive entries whose retention ended.
     *
     * @return Uni with the number of archived entries, 0 when the repository failed
     */
    public Uni<Integer> archiveExpired() {
        return repository
                .archiveExpired(clock.instant())
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Archived %d expired audit entries", count);
                    }
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Audit archival failed: %s", e.getMessage());
                    return 0;
                });
    }

    public AuditSinkHealth health() {
        return new AuditSinkHealth(
                degraded.get(), fallbackSink.writeCount(), lastFailureAt, lastFailureReason, pendingWrites.get());
    }
}
