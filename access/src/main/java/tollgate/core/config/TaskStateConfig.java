package tollgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the task state tracker.
 *
 * <p>Configuration prefix: {@code tollgate.state}
 */
@ConfigMapping(prefix = "tollgate.state")
public interface TaskStateConfig {

    /**
     * How long a task's state is kept after its last write. Should cover the
     * review window between a dry run and the apply step.
     *
     * @return retention (default: 7 days)
     */
    @WithDefault("P7D")
    Duration retention();

    /**
     * Root directory that relative resource addresses are resolved against when
     * reading original content for diffs.
     *
     * @return content root (default: working directory)
     */
    @WithDefault(".")
    String contentRoot();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * @return true to store state in Redis when it is reachable (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return key prefix (default: "tollgate:state:")
         */
        @WithDefault("tollgate:state:")
        String keyPrefix();
    }
}
