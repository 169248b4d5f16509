package tollgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the external API quota.
 *
 * <p>Configuration prefix: {@code tollgate.quota}
 *
 * <p>The defaults match an authenticated GitHub client: 5000 calls per hour.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_QUOTA_CALLS_PER_WINDOW} - calls allowed per window</li>
 *   <li>{@code TOLLGATE_QUOTA_WINDOW} - quota window, e.g. "PT1H"</li>
 *   <li>{@code TOLLGATE_QUOTA_REDIS_ENABLED} - share the bucket through Redis</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate.quota")
public interface QuotaConfig {

    /**
     * @return calls the API allows per window (default: 5000)
     */
    @WithDefault("5000")
    long callsPerWindow();

    /**
     * @return the quota window (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration window();

    /**
     * When the remaining estimate drops below this many tokens, callers asking
     * to wait are slowed down.
     *
     * @return low-water mark (default: 100)
     */
    @WithDefault("100")
    long lowWaterMark();

    /**
     * Upper bound on a single smoothing wait.
     *
     * @return maximum wait (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration maxWait();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Coordinate the bucket across processes through Redis. When disabled or
         * unavailable, each process meters locally.
         *
         * @return true to use Redis (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return Redis key of the shared bucket (default: "tollgate:quota:bucket")
         */
        @WithDefault("tollgate:quota:bucket")
        String key();

        /**
         * Minimum expiry of the bucket key, refreshed on every call. An idle bucket
         * that expires is recreated full, so the limiter never uses less than twice
         * the time a drained bucket needs to refill, whatever this is set to.
         *
         * @return minimum key TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration keyTtl();
    }
}
