package tollgate.core.model.quota;

/**
 * Token bucket state.
 *
 * <p>The bucket holds a real-valued number of tokens that refills continuously. Each
 * granted call removes tokens; when too few are left the call is denied.
 *
 * @param tokens the current number of tokens in the bucket
 * @param lastRefillMillis the timestamp of the last refill operation (epoch millis)
 */
public record BucketState(double tokens, long lastRefillMillis) {

    /**
     * Creates a bucket state with validation.
     */
    public BucketState {
        if (tokens < 0 || Double.isNaN(tokens)) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
        if (lastRefillMillis < 0) {
            throw new IllegalArgumentException("lastRefillMillis must be non-negative");
        }
    }

    /**
     * Creates an initial bucket state with full capacity.
     *
     * @param capacity the initial token count
     * @param nowMillis the creation time
     * @return the initial state
     */
    public static BucketState full(long capacity, long nowMillis) {
        return new BucketState(capacity, nowMillis);
    }

    /**
     * Returns the state after lazily refilling for the time elapsed since the last refill.
     *
     * <p>The refill timestamp never moves backwards, so a clock that steps back adds
     * no tokens and keeps the previous timestamp.
     *
     * @param policy the bucket parameters
     * @param nowMillis the current time
     * @return the refilled state, capped at capacity
     */
    public BucketState refill(QuotaPolicy policy, long nowMillis) {
        if (nowMillis <= lastRefillMillis) {
            return this;
        }
        final var elapsedSeconds = (nowMillis - lastRefillMillis) / 1000.0;
        final var refilled = Math.min(policy.capacity(), tokens + elapsedSeconds * policy.refillRatePerSecond());
        return new BucketState(refilled, nowMillis);
    }

    /**
     * Returns a new state after consuming tokens.
     *
     * @param permits the number of tokens to remove
     * @return the new state
     * @throws IllegalStateException if not enough tokens are available
     */
    public BucketState consume(int permits) {
        if (tokens < permits) {
            throw new IllegalStateException("Not enough tokens available to consume");
        }
        return new BucketState(tokens - permits, lastRefillMillis);
    }
}
