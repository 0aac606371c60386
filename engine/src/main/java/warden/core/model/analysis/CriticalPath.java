package warden.core.model.analysis;

import java.util.List;

/**
 * Chain of elevated-risk edges starting at one source node.
 *
 * @param nodes     source followed by every target it reaches through an elevated edge
 * @param totalRisk sum of the chained edge strengths
 */
public record CriticalPath(List<String> nodes, double totalRisk) {

    public CriticalPath {
        nodes = List.copyOf(nodes);
    }
}
