package tollgate.core.model.quota;

/**
 * Lazy-refill token bucket algorithm.
 *
 * <p>On every consume the bucket is first refilled for the elapsed time (capped at
 * capacity), then the requested permits are granted if enough tokens are present.
 * A denial leaves the token count as refilled. No background timer is involved.
 *
 * <p>The algorithm is pure; callers own the state and its synchronization.
 */
public final class TokenBucketAlgorithm {

    private static final TokenBucketAlgorithm INSTANCE = new TokenBucketAlgorithm();

    private TokenBucketAlgorithm() {}

    /**
     * Returns the singleton instance.
     *
     * @return the algorithm instance
     */
    public static TokenBucketAlgorithm getInstance() {
        return INSTANCE;
    }

    /**
     * Refills the bucket and tries to consume the given number of permits.
     *
     * @param currentState the current state, or null for a fresh (full) bucket
     * @param policy the bucket parameters
     * @param permits the number of tokens requested
     * @param nowMillis the current time
     * @return the decision, carrying the new state
     */
    public QuotaDecision tryConsume(BucketState currentState, QuotaPolicy policy, int permits, long nowMillis) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }

        final var refilled = resolveState(currentState, policy, nowMillis).refill(policy, nowMillis);

        if (refilled.tokens() >= permits) {
            final var consumed = refilled.consume(permits);
            return QuotaDecision.granted(consumed.tokens(), QuotaSource.LOCAL, consumed);
        }

        final var retryAfter = policy.timeToRefill(permits - refilled.tokens());
        return QuotaDecision.denied(refilled.tokens(), retryAfter, QuotaSource.LOCAL, refilled);
    }

    /**
     * Computes the tokens available now without modifying the state.
     *
     * @param currentState the current state, or null for a fresh (full) bucket
     * @param policy the bucket parameters
     * @param nowMillis the current time
     * @return the available tokens
     */
    public double available(BucketState currentState, QuotaPolicy policy, long nowMillis) {
        return resolveState(currentState, policy, nowMillis).refill(policy, nowMillis).tokens();
    }

    private BucketState resolveState(BucketState currentState, QuotaPolicy policy, long nowMillis) {
        if (currentState == null) {
            return BucketState.full(policy.capacity(), nowMillis);
        }
        return currentState;
    }
}
