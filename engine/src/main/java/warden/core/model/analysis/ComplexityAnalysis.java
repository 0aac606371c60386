package warden.core.model.analysis;

import java.time.Instant;
import java.util.List;

/**
 * Dependency and vulnerability report for one identifier (or {@code global}).
 */
public record ComplexityAnalysis(
        String identifier,
        List<DependencyEdge> dependencies,
        List<CriticalPath> criticalPaths,
        List<Vulnerability> vulnerabilities,
        List<String> recommendations,
        int complexityScore,
        Instant analyzedAt) {

    public ComplexityAnalysis {
        dependencies = List.copyOf(dependencies);
        criticalPaths = List.copyOf(criticalPaths);
        vulnerabilities = List.copyOf(vulnerabilities);
        recommendations = List.copyOf(recommendations);
    }
}
