package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.model.ratelimit.RateLimitRecord;
import warden.core.model.ratelimit.RateLimitStatus;
import warden.spi.RateLimitRecordStore;
import warden.spi.StorageProviderException;

/**
 * Per-identifier attempt counting with lockouts and progressive delays for one scope.
 *
 * <p>
 * Keys are namespaced as {@code <scope>:<identifier>} so several scopes share one
 * {@link RateLimitRecordStore}. Every read-modify-write goes through
 * {@link RateLimitRecordStore#compute}, so concurrent check and record calls for the same
 * identifier cannot bypass a lockout.
 *
 * <p>
 * Checks never throw on store failure: they fail closed (deny with a retry-after) or open
 * depending on configuration. Record operations propagate {@link StorageProviderException}.
 */
public class RateLimitStore {

    private static final Logger LOG = Logger.getLogger(RateLimitStore.class);

    private final String scope;
    private final RateLimitPolicy policy;
    private final RateLimitRecordStore store;
    private final Clock clock;
    private final boolean failClosed;
    private final Duration failClosedRetryAfter;

    public RateLimitStore(
            String scope,
            RateLimitPolicy policy,
            RateLimitRecordStore store,
            Clock clock,
            boolean failClosed,
            Duration failClosedRetryAfter) {
        this.scope = scope;
        this.policy = policy;
        this.store = store;
        this.clock = clock;
        this.failClosed = failClosed;
        this.failClosedRetryAfter = failClosedRetryAfter;
    }

    public String scope() {
        return scope;
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    /**
     * Check whether an attempt may proceed, applying lock and reset transitions.
     *
     * <ol>
     *   <li>No record: allow.</li>
     *   <li>Locked: deny until the lock ends, CAPTCHA required.</li>
     *   <li>Inside the progressive delay: deny for the remaining delay.</li>
     *   <li>Idle longer than the window: delete the record and allow.</li>
     *   <li>Limit reached: lock and deny.</li>
     *   <li>Otherwise allow, with CAPTCHA once the threshold is reached.</li>
     * </ol>
     *
     * @param identifier identifier within this scope
     * @return the decision
     */
    public RateLimitDecision check(String identifier) {
        final var key = key(identifier);
        final var now = clock.instant();
        final var decision = new AtomicReference<>(RateLimitDecision.allow());
        try {
            store.compute(key, current -> {
                if (current == null) {
                    return null;
                }
                if (current.isLocked(now)) {
                    decision.set(RateLimitDecision.deny(
                            Duration.between(now, current.lockedUntil()), true, current.attempts()));
                    return current;
                }
                if (current.isDelayed(now)) {
                    decision.set(RateLimitDecision.deny(
                            Duration.between(now, current.nextAttemptAllowed()),
                            policy.needsCaptcha(current.attempts()),
                            current.attempts()));
                    return current;
                }
                if (Duration.between(current.lastAttempt(), now).compareTo(policy.window()) > 0) {
                    LOG.debugf("Rate limit window passed for %s, resetting", key);
                    return null;
                }
                if (current.attempts() >= policy.maxAttempts()) {
                    if (policy.locks()) {
                        final var lockedUntil = now.plus(policy.lockoutDuration());
                        LOG.infof("Locking %s until %s after %.1f attempts", key, lockedUntil, current.attempts());
                        decision.set(RateLimitDecision.deny(policy.lockoutDuration(), true, current.attempts()));
                        return current.lockedUntil(lockedUntil);
                    }
                    decision.set(RateLimitDecision.deny(windowRemaining(current, now), true, current.attempts()));
                    return current;
                }
                decision.set(RateLimitDecision.allow(
                        current.attempts(), policy.needsCaptcha(current.attempts()), Duration.ZERO));
                return current;
            });
        } catch (StorageProviderException e) {
            return unavailable(key, e);
        }
        return decision.get();
    }

    /**
     * Evaluate the scope without changing any state.
     *
     * <p>
     * A record idle longer than the window reads as zero attempts. At the limit the wait
     * is the time until the window ends. Unless the policy enforces it, the progressive
     * delay is only reported.
     *
     * @param identifier identifier within this scope
     * @return the decision
     */
    public RateLimitDecision peek(String identifier) {
        final var key = key(identifier);
        final var now = clock.instant();
        final RateLimitRecord current;
        try {
            current = store.find(key).orElse(null);
        } catch (StorageProviderException e) {
            return unavailable(key, e);
        }
        if (current == null) {
            return RateLimitDecision.allow();
        }
        if (current.isLocked(now)) {
            return RateLimitDecision.deny(Duration.between(now, current.lockedUntil()), true, current.attempts());
        }
        if (current.isStale(now, policy.window())) {
            return RateLimitDecision.allow();
        }
        if (current.attempts() >= policy.maxAttempts()) {
            return RateLimitDecision.deny(windowRemaining(current, now), true, current.attempts());
        }
        if (policy.enforceProgressiveDelay() && current.isDelayed(now)) {
            return RateLimitDecision.deny(
                    Duration.between(now, current.nextAttemptAllowed()),
                    policy.needsCaptcha(current.attempts()),
                    current.attempts());
        }
        return RateLimitDecision.allow(
                current.attempts(),
                policy.needsCaptcha(current.attempts()),
                policy.progressiveDelay(current.attempts()));
    }

    /**
     * Count a failed attempt.
     *
     * @param identifier identifier within this scope
     * @param weight     attempts to add (1.0 for a full attempt)
     * @return the updated record
     * @throws StorageProviderException if the store is unavailable
     */
    public RateLimitRecord recordFailure(String identifier, double weight) {
        final var key = key(identifier);
        final var now = clock.instant();
        return store.compute(key, current -> {
            final var fresh = current == null || current.isStale(now, policy.window());
            final var attempts = fresh ? weight : current.attempts() + weight;
            final var delay = policy.progressiveDelay(attempts);
            var updated = fresh
                    ? RateLimitRecord.first(key, attempts, now, delay)
                    : current.withAttempt(attempts, now, delay);
            if (attempts >= policy.maxAttempts() && policy.locks() && !updated.isLocked(now)) {
                updated = updated.lockedUntil(now.plus(policy.lockoutDuration()));
                LOG.infof("Locking %s until %s after %.1f attempts", key, updated.lockedUntil(), attempts);
            }
            return updated;
        });
    }

    /**
     * Add a penalty without counting it as an attempt in time.
     *
     * <p>
     * Unlike {@link #recordFailure}, an existing record keeps its {@code lastAttempt} and
     * progressive delay, so penalties never push the end of the window back. A missing or
     * stale record starts a new window now.
     *
     * @param identifier identifier within this scope
     * @param weight     attempts to add
     * @return the updated record
     * @throws StorageProviderException if the store is unavailable
     */
    public RateLimitRecord addPenalty(String identifier, double weight) {
        final var key = key(identifier);
        final var now = clock.instant();
        return store.compute(key, current -> {
            if (current == null || current.isStale(now, policy.window())) {
                return RateLimitRecord.first(key, weight, now, Duration.ZERO);
            }
            var updated = current.withAttempts(current.attempts() + weight);
            if (updated.attempts() >= policy.maxAttempts() && policy.locks() && !updated.isLocked(now)) {
                updated = updated.lockedUntil(now.plus(policy.lockoutDuration()));
                LOG.infof("Locking %s until %s after %.1f attempts", key, updated.lockedUntil(), updated.attempts());
            }
            return updated;
        });
    }

    /**
     * Forget all attempts of an identifier. Idempotent.
     *
     * @param identifier identifier within this scope
     * @throws StorageProviderException if the store is unavailable
     */
    public void recordSuccess(String identifier) {
        store.delete(key(identifier));
    }

    /**
     * Current counters of an identifier, for display.
     *
     * @param identifier identifier within this scope
     * @return status, clean when nothing is recorded
     */
    public RateLimitStatus status(String identifier) {
        final var now = clock.instant();
        final var current = store.find(key(identifier)).orElse(null);
        if (current == null || current.isStale(now, policy.window())) {
            return RateLimitStatus.clean(policy.maxAttempts());
        }
        return new RateLimitStatus(
                current.attempts(),
                Math.max(0, policy.maxAttempts() - current.attempts()),
                current.isLocked(now) ? current.lockedUntil() : null,
                current.isDelayed(now) ? current.nextAttemptAllowed() : null);
    }

    /**
     * Raw record of an identifier, if any.
     */
    public RateLimitRecord find(String identifier) {
        return store.find(key(identifier)).orElse(null);
    }

    public void clear(String identifier) {
        store.delete(key(identifier));
    }

    /**
     * Delete every record of this scope.
     */
    public void clearAll() {
        store.clear(scope + ":");
    }

    /**
     * Remove records of this scope whose window passed and whose lock ended.
     *
     * @param now sweep time
     * @return number of removed records
     */
    public int sweepExpired(Instant now) {
        final var prefix = scope + ":";
        return store.removeIf((key, record) -> key.startsWith(prefix) && record.isStale(now, policy.window()));
    }

    String key(String identifier) {
        return scope + ":" + identifier;
    }

    private Duration windowRemaining(RateLimitRecord record, Instant now) {
        return Duration.between(now, record.lastAttempt().plus(policy.window()));
    }

    private RateLimitDecision unavailable(String key, StorageProviderException e) {
        if (failClosed) {
            LOG.warnf("Rate limit store unavailable for %s, denying: %s", key, e.getMessage());
        } else {
            LOG.warnf("Rate limit store unavailable for %s, allowing: %s", key, e.getMessage());
        }
        return RateLimitDecision.storeUnavailable(failClosed, failClosedRetryAfter);
    }
}
