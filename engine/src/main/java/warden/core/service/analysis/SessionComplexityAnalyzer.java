package warden.core.service.analysis;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.cache.CaffeineLocalCache;
import warden.core.cache.LocalCache;
import warden.core.config.AnalysisConfig;
import warden.core.model.RiskLevel;
import warden.core.model.analysis.ComplexityAnalysis;
import warden.core.model.analysis.ComplexityMetrics;
import warden.core.model.analysis.CriticalPath;
import warden.core.model.analysis.DependencyEdge;
import warden.core.model.analysis.Vulnerability;
import warden.core.model.audit.AuditEventType;
import warden.core.model.audit.AuditLogEntry;
import warden.core.model.audit.AuditMetadata;
import warden.core.model.audit.AuditResult;
import warden.core.model.session.SessionObservation;
import warden.core.model.session.SessionSecuritySummary;
import warden.core.port.in.AuditTrail;
import warden.core.service.session.SessionSecurityValidator;

/**
 * Derives dependency and vulnerability reports from session validation output.
 *
 * <p>
 * Signals (device fingerprint, IP address, concurrent sessions, security score) are linked
 * to the controls that depend on them, each edge with a strength and a heuristic risk.
 * Elevated edges form critical paths grouped by source. Results are cached per user, or
 * under {@code global} when no user is given.
 */
@ApplicationScoped
public class SessionComplexityAnalyzer {

    private static final Logger LOG = Logger.getLogger(SessionComplexityAnalyzer.class);

    static final String GLOBAL = "global";

    private static final int HIJACKING_DEVICE_THRESHOLD = 2;
    private static final int CONCURRENT_ABUSE_THRESHOLD = 3;
    private static final int WEAK_SCORE_THRESHOLD = 50;

    private final SessionSecurityValidator validator;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final LocalCache<String, ComplexityAnalysis> analyses;

    public SessionComplexityAnalyzer(
            AnalysisConfig config, SessionSecurityValidator validator, AuditTrail auditTrail, Clock clock) {
        this.validator = validator;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.analyses = new CaffeineLocalCache<>(config.cacheTtl(), config.cacheMaxSize(), clock);
    }

    /**
     * Analyze the sessions of a user, or of all users when {@code userId} is null.
     *
     * @param userId user to analyze (may be null)
     * @return the analysis; on internal failure a report with a single {@code analysis_error} finding
     */
    public ComplexityAnalysis analyzeSessionComplexity(String userId) {
        final var key = userId != null ? userId : GLOBAL;
        final var cached = analyses.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        try {
            final var analysis = analyze(key, userId);
            analyses.put(key, analysis);
            auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.SESSION_ANALYSIS)
                    .result(AuditResult.SUCCESS)
                    .userId(userId != null ? userId : "system")
                    .reason("Session complexity analysis completed")
                    .metadata(new AuditMetadata.Analysis(
                            analysis.complexityScore(),
                            analysis.dependencies().size(),
                            analysis.vulnerabilities().size(),
                            analysis.criticalPaths().size()))
                    .build());
            return analysis;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Session complexity analysis failed for %s", key);
            auditTrail.logEvent(AuditLogEntry.builder(AuditEventType.SESSION_ANALYSIS)
                    .result(AuditResult.FAILURE)
                    .userId(userId != null ? userId : "system")
                    .reason("Session complexity analysis failed")
                    .build());
            return new ComplexityAnalysis(
                    key,
                    List.of(),
                    List.of(),
                    List.of(new Vulnerability(
                            "analysis_error",
                            RiskLevel.HIGH,
                            "Failed to complete session complexity analysis",
                            "Review system logs and retry analysis",
                            0)),
                    List.of("System error occurred - review logs and retry"),
                    0,
                    clock.instant());
        }
    }

    private ComplexityAnalysis analyze(String key, String userId) {
        final var history = validator.getSessionHistory(userId);
        final var current = userId != null && validator.getSessionSecurityInfo(userId).isPresent()
                ? latest(history)
                : Optional.<SessionObservation>empty();
        final var summary = validator.getSecuritySummary();

        final var dependencies = dependencies(current, history, summary);
        final var criticalPaths = criticalPaths(dependencies);
        final var vulnerabilities = vulnerabilities(current, history, dependencies);
        final var recommendations = recommendations(vulnerabilities, criticalPaths);
        final var score = complexityScore(dependencies, vulnerabilities, summary);

        LOG.debugf("Complexity of %s: score %d, %d vulnerabilities", key, score, vulnerabilities.size());
        return new ComplexityAnalysis(
                key, dependencies, criticalPaths, vulnerabilities, recommendations, score, clock.instant());
    }

    static List<DependencyEdge> dependencies(
            Optional<SessionObservation> current, List<SessionObservation> history, SessionSecuritySummary summary) {
        final var edges = new ArrayList<DependencyEdge>();

        current.map(SessionObservation::deviceFingerprint).ifPresent(fingerprint -> {
            final var sightings = history.stream()
                    .filter(o -> fingerprint.equals(o.deviceFingerprint()))
                    .count();
            edges.add(new DependencyEdge(
                    "device_fingerprint", "session_validation", 0.8, sightings > 1 ? RiskLevel.LOW : RiskLevel.MEDIUM));
        });

        current.map(SessionObservation::ipAddress).ifPresent(ip -> {
            final var distinctIps = history.stream()
                    .map(SessionObservation::ipAddress)
                    .collect(Collectors.toSet())
                    .size();
            final var risk = distinctIps > 3 ? RiskLevel.HIGH : distinctIps > 1 ? RiskLevel.MEDIUM : RiskLevel.LOW;
            edges.add(new DependencyEdge("ip_address", "session_security", 0.6, risk));
        });

        if (summary.totalSessions() > 1) {
            edges.add(new DependencyEdge(
                    "concurrent_sessions",
                    "resource_allocation",
                    0.7,
                    summary.totalSessions() > 3 ? RiskLevel.HIGH : RiskLevel.MEDIUM));
        }

        current.ifPresent(observation -> {
            final var score = observation.securityScore();
            final RiskLevel risk;
            if (score < 50) {
                risk = RiskLevel.CRITICAL;
            } else if (score < 70) {
                risk = RiskLevel.HIGH;
            } else if (score < 85) {
                risk = RiskLevel.MEDIUM;
            } else {
                risk = RiskLevel.LOW;
            }
            edges.add(new DependencyEdge("security_score", "access_control", 0.9, risk));
        });

        return edges;
    }

    static List<CriticalPath> criticalPaths(List<DependencyEdge> dependencies) {
        final var bySource = new LinkedHashMap<String, List<DependencyEdge>>();
        for (final var edge : dependencies) {
            if (edge.isCritical()) {
                bySource.computeIfAbsent(edge.source(), s -> new ArrayList<>()).add(edge);
            }
        }
        final var paths = new ArrayList<CriticalPath>();
        bySource.forEach((source, edges) -> {
            final var nodes = new ArrayList<String>();
            nodes.add(source);
            edges.forEach(e -> nodes.add(e.target()));
            paths.add(new CriticalPath(nodes, edges.stream().mapToDouble(DependencyEdge::strength).sum()));
        });
        return paths;
    }

    static List<Vulnerability> vulnerabilities(
            Optional<SessionObservation> current, List<SessionObservation> history, List<DependencyEdge> dependencies) {
        final var findings = new ArrayList<Vulnerability>();

        final var distinctDevices = history.stream()
                .map(SessionObservation::deviceFingerprint)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        if (distinctDevices > HIJACKING_DEVICE_THRESHOLD) {
            findings.add(new Vulnerability(
                    "session_hijacking",
                    RiskLevel.HIGH,
                    "Multiple device fingerprints detected for user sessions",
                    "Implement stronger device binding and require re-authentication",
                    history.size()));
        }

        final var concurrent = current.map(SessionObservation::activeSessions).orElse(0);
        if (concurrent > CONCURRENT_ABUSE_THRESHOLD) {
            findings.add(new Vulnerability(
                    "concurrent_session_abuse",
                    RiskLevel.MEDIUM,
                    "Excessive concurrent sessions detected",
                    "Reduce maximum concurrent session limit and monitor usage patterns",
                    concurrent));
        }

        if (current.isPresent() && current.get().securityScore() < WEAK_SCORE_THRESHOLD) {
            findings.add(new Vulnerability(
                    "weak_security_posture",
                    RiskLevel.CRITICAL,
                    "Session security score is critically low",
                    "Force re-authentication and review security policies",
                    1));
        }

        if (dependencies.stream().anyMatch(d -> d.riskLevel() == RiskLevel.CRITICAL)) {
            findings.add(new Vulnerability(
                    "critical_dependency",
                    RiskLevel.HIGH,
                    "Critical security dependencies detected",
                    "Review and strengthen critical dependency chains",
                    history.size()));
        }
        return findings;
    }

    static List<String> recommendations(List<Vulnerability> vulnerabilities, List<CriticalPath> criticalPaths) {
        final var recommendations = new ArrayList<String>();
        if (vulnerabilities.stream().anyMatch(v -> v.severity() == RiskLevel.CRITICAL)) {
            recommendations.add("Immediate action required: Force user re-authentication for critical vulnerabilities");
        }
        if (!criticalPaths.isEmpty()) {
            recommendations.add("Review and strengthen security dependency chains");
        }
        if (vulnerabilities.stream().anyMatch(v -> v.type().equals("session_hijacking"))) {
            recommendations.add("Implement enhanced device fingerprinting and session binding");
        }
        if (vulnerabilities.stream().anyMatch(v -> v.type().equals("concurrent_session_abuse"))) {
            recommendations.add("Review and adjust concurrent session limits");
        }
        if (vulnerabilities.isEmpty()) {
            recommendations.add("Session security posture is good - maintain current policies");
        }
        return recommendations;
    }

    /**
     * 10 per edge, 20 per elevated edge, 15 per finding, 30 per critical finding, 5 per
     * session and half the average score deficit, capped at 100.
     */
    static int complexityScore(
            List<DependencyEdge> dependencies, List<Vulnerability> vulnerabilities, SessionSecuritySummary summary) {
        var score = 0.0;
        score += dependencies.size() * 10;
        score += dependencies.stream().filter(DependencyEdge::isCritical).count() * 20;
        score += vulnerabilities.size() * 15;
        score += vulnerabilities.stream()
                        .filter(v -> v.severity() == RiskLevel.CRITICAL)
                        .count()
                * 30;
        score += summary.totalSessions() * 5;
        score += (100 - summary.averageSecurityScore()) * 0.5;
        return (int) Math.round(Math.min(100.0, Math.max(0.0, score)));
    }

    /**
     * Raw metrics over the sessions of a user, or of all users when {@code userId} is null.
     */
    public ComplexityMetrics getComplexityMetrics(String userId) {
        final var history = validator.getSessionHistory(userId);
        final var bands = new LinkedHashMap<String, Integer>();
        bands.put("0-49", 0);
        bands.put("50-69", 0);
        bands.put("70-84", 0);
        bands.put("85-100", 0);
        var totalScore = 0L;
        var totalAgeMillis = 0L;
        var aged = 0;
        for (final var observation : history) {
            final var score = observation.securityScore();
            final var band = score < 50 ? "0-49" : score < 70 ? "50-69" : score < 85 ? "70-84" : "85-100";
            bands.merge(band, 1, Integer::sum);
            totalScore += score;
            if (observation.sessionCreatedAt() != null) {
                totalAgeMillis += Duration.between(observation.sessionCreatedAt(), observation.observedAt())
                        .toMillis();
                aged++;
            }
        }
        return new ComplexityMetrics(
                history.size(),
                (int) history.stream()
                        .map(SessionObservation::deviceFingerprint)
                        .filter(Objects::nonNull)
                        .distinct()
                        .count(),
                (int) history.stream()
                        .map(SessionObservation::ipAddress)
                        .filter(Objects::nonNull)
                        .distinct()
                        .count(),
                bands,
                history.isEmpty() ? 100.0 : (double) totalScore / history.size(),
                aged > 0 ? Duration.ofMillis(totalAgeMillis / aged) : Duration.ZERO);
    }

    public void clearCaches() {
        analyses.invalidateAll();
    }

    private static Optional<SessionObservation> latest(List<SessionObservation> history) {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }
}
