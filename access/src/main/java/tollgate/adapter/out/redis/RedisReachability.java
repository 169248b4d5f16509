package tollgate.adapter.out.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

/**
 * Startup probe for the shared store.
 *
 * <p>Components that choose their backend once at construction use this to decide
 * whether Redis answers at all before committing to it.
 */
public final class RedisReachability {

    private static final Logger LOG = Logger.getLogger(RedisReachability.class);

    private RedisReachability() {}

    /**
     * Send a PING and wait for the answer.
     *
     * @param dataSource the Redis data source
     * @param timeout how long to wait for the answer
     * @return true if Redis answered in time
     */
    public static boolean ping(ReactiveRedisDataSource dataSource, Duration timeout) {
        try {
            final var response = dataSource.execute("PING").await().atMost(timeout);
            return response != null;
        } catch (RuntimeException e) {
            LOG.warnv("Redis did not answer PING within {0}: {1}", timeout, e.getMessage());
            return false;
        }
    }
}
