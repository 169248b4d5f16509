package tollgate.core.service.quota;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.QuotaConfig;
import tollgate.core.model.quota.QuotaDecision;
import tollgate.core.model.quota.QuotaExceededException;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.QuotaLimiter;

/**
 * Sole gate on the external API's call quota.
 *
 * <p>Callers acquire a token before every external call. A denial fails the returned
 * {@link Uni} with {@link QuotaExceededException}; the caller is expected to serve
 * cached data or defer the work, never to proceed unmetered.
 *
 * <p>Callers that would rather slow down than fail can call {@link #waitIfNeeded()}
 * first: when the bucket runs low it delays them in proportion to the shortfall, up
 * to a fixed ceiling, which spreads bursts out instead of letting them all fail at once.
 */
@ApplicationScoped
public class QuotaGuard {

    private static final Logger LOG = Logger.getLogger(QuotaGuard.class);

    private final QuotaLimiter limiter;
    private final AccessMetrics metrics;
    private final long lowWaterMark;
    private final Duration maxWait;

    @Inject
    public QuotaGuard(QuotaLimiter limiter, AccessMetrics metrics, QuotaConfig config) {
        this(limiter, metrics, config.lowWaterMark(), config.maxWait());
    }

    public QuotaGuard(QuotaLimiter limiter, AccessMetrics metrics, long lowWaterMark, Duration maxWait) {
        this.limiter = limiter;
        this.metrics = metrics;
        this.lowWaterMark = lowWaterMark;
        this.maxWait = maxWait;
    }

    /**
     * Take one token for a call to the given endpoint.
     *
     * @param endpointLabel label of the endpoint about to be called, for logging
     * @return the grant decision; fails with {@link QuotaExceededException} when denied
     */
    public Uni<QuotaDecision> acquire(String endpointLabel) {
        return limiter.tryConsume(1).flatMap(decision -> {
            metrics.recordQuotaDecision(decision.granted(), decision.source());
            if (decision.granted()) {
                LOG.debugf(
                        "API call allowed for endpoint %s (%d remaining, %s)",
                        endpointLabel, decision.remainingCalls(), decision.source());
                return Uni.createFrom().item(decision);
            }
            LOG.warnv(
                    "Quota exceeded for endpoint {0}, retry after {1} ({2})",
                    endpointLabel, decision.retryAfter(), decision.source());
            return Uni.createFrom().failure(new QuotaExceededException(endpointLabel, decision.retryAfter()));
        });
    }

    /**
     * Estimate how many calls remain.
     *
     * <p>May be optimistic while the coordinated limiter is degraded to its local bucket.
     *
     * @return remaining whole calls
     */
    public Uni<Long> remainingEstimate() {
        return limiter.availableTokens().map(tokens -> (long) Math.floor(tokens));
    }

    /**
     * Delay the caller when the bucket is running low.
     *
     * @return the time waited, zero when the estimate is above the low-water mark
     */
    public Uni<Duration> waitIfNeeded() {
        return remainingEstimate().flatMap(remaining -> {
            final var wait = computeWait(remaining);
            if (wait.isZero()) {
                return Uni.createFrom().item(Duration.ZERO);
            }
            LOG.infov("Quota low ({0} remaining), waiting {1}", remaining, wait);
            metrics.recordQuotaWait(wait);
            return Uni.createFrom().item(wait).onItem().delayIt().by(wait);
        });
    }

    /**
     * Computes the smoothing delay for a remaining estimate.
     *
     * @param remaining the remaining whole calls
     * @return the shortfall below the low-water mark divided by the refill rate, capped at the maximum wait
     */
    Duration computeWait(long remaining) {
        if (remaining >= lowWaterMark) {
            return Duration.ZERO;
        }
        final var wait = limiter.policy().timeToRefill(lowWaterMark - remaining);
        return wait.compareTo(maxWait) > 0 ? maxWait : wait;
    }
}
