package tollgate.core.model.quota;

import java.time.Duration;

/**
 * Token bucket parameters derived from the external API's published quota.
 *
 * <p>For example 5000 calls per hour gives a capacity of 5000 tokens and a refill rate
 * of {@code 5000 / 3600} tokens per second.
 *
 * @param capacity the maximum number of tokens the bucket holds
 * @param refillRatePerSecond tokens added per second of elapsed time
 */
public record QuotaPolicy(long capacity, double refillRatePerSecond) {

    public QuotaPolicy {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillRatePerSecond <= 0 || Double.isNaN(refillRatePerSecond) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refillRatePerSecond must be a positive finite number");
        }
    }

    /**
     * Creates a policy from a "calls per window" quota.
     *
     * @param callsPerWindow the number of calls the API allows per window
     * @param window the quota window
     * @return the derived policy
     */
    public static QuotaPolicy of(long callsPerWindow, Duration window) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        final var windowSeconds = window.toMillis() / 1000.0;
        return new QuotaPolicy(callsPerWindow, callsPerWindow / windowSeconds);
    }

    /**
     * Returns how long it takes to accumulate the given number of tokens.
     *
     * @param tokens the token shortfall
     * @return time to refill that many tokens, zero when nothing is missing
     */
    public Duration timeToRefill(double tokens) {
        if (tokens <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) Math.ceil(tokens / refillRatePerSecond * 1000.0));
    }
}
