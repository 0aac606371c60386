package warden.core.model.analysis;

import warden.core.model.RiskLevel;

/**
 * Edge from a signal source to the control it feeds.
 *
 * @param source    signal node (e.g. {@code ip_address})
 * @param target    control node (e.g. {@code session_security})
 * @param strength  0.0-1.0 coupling weight
 * @param riskLevel heuristic risk of the edge
 */
public record DependencyEdge(String source, String target, double strength, RiskLevel riskLevel) {

    public boolean isCritical() {
        return riskLevel.isElevated();
    }
}
