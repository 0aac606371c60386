package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session complexity analysis.
 *
 * <p>Configuration prefix: {@code warden.analysis}
 */
@ConfigMapping(prefix = "warden.analysis")
public interface AnalysisConfig {

    /**
     * @return how long an analysis is reused (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration cacheTtl();

    /**
     * @return maximum cached analyses (default: 1000)
     */
    @WithDefault("1000")
    long cacheMaxSize();
}
