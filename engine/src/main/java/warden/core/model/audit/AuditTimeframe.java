package warden.core.model.audit;

import java.time.Duration;

/**
 * Look-back windows for audit statistics.
 */
public enum AuditTimeframe {
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration lookBack;

    AuditTimeframe(Duration lookBack) {
        this.lookBack = lookBack;
    }

    public Duration lookBack() {
        return lookBack;
    }

    /**
     * Parse a timeframe name case-insensitively, defaulting to {@link #DAY}.
     */
    public static AuditTimeframe parse(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        for (final var timeframe : values()) {
            if (timeframe.name().equalsIgnoreCase(value.trim())) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown audit timeframe: " + value);
    }
}
