package warden.core.model;

/**
 * Ordinal risk classification shared by audit entries, session verdicts and analysis findings.
 *
 * <p>Declaration order is the severity order; comparisons go through {@link #max(RiskLevel)}
 * and {@link #isAtLeast(RiskLevel)} rather than string or index arithmetic.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Return the more severe of this level and {@code other}.
     *
     * @param other the level to compare with (null is treated as LOW)
     * @return the higher of the two levels
     */
    public RiskLevel max(RiskLevel other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * HIGH and CRITICAL levels trigger alerts, reviews and critical paths.
     */
    public boolean isElevated() {
        return isAtLeast(HIGH);
    }
}
