package warden.core.model.analysis;

import java.time.Duration;
import java.util.Map;

/**
 * Raw session metrics behind a complexity analysis.
 *
 * @param totalSessions          sessions in the observed history
 * @param deviceVariability      distinct device fingerprints
 * @param ipVariability          distinct IP addresses
 * @param scoreDistribution      sessions per score band ({@code 0-49}, {@code 50-69}, {@code 70-84}, {@code 85-100})
 * @param averageSecurityScore   mean security score, 100 when nothing was observed
 * @param averageSessionAge      mean age of the observed sessions
 */
public record ComplexityMetrics(
        int totalSessions,
        int deviceVariability,
        int ipVariability,
        Map<String, Integer> scoreDistribution,
        double averageSecurityScore,
        Duration averageSessionAge) {}
