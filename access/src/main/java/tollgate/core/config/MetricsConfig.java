package tollgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for access-layer metrics.
 *
 * <p>Configuration prefix: {@code tollgate.metrics}
 */
@ConfigMapping(prefix = "tollgate.metrics")
public interface MetricsConfig {

    /**
     * @return true to record metrics (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
