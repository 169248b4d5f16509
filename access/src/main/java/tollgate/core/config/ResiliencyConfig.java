package tollgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for timeouts on the shared store.
 *
 * <p>Configuration prefix: {@code tollgate.resiliency}
 */
@ConfigMapping(prefix = "tollgate.resiliency")
public interface ResiliencyConfig {

    /**
     * Redis timeout configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Maximum time to wait for a Redis operation before degrading.
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();

        /**
         * Maximum time to wait for the reachability probe at startup.
         *
         * @return probe timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration probeTimeout();
    }
}
