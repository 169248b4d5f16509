package tollgate.core.model.quota;

import java.time.Duration;

/**
 * Result of a quota check.
 *
 * @param granted whether the call may proceed
 * @param remaining tokens left after the decision
 * @param retryAfter how long until the requested permits become available (zero when granted)
 * @param source the bucket that made the decision
 * @param newState the updated local bucket state, null for coordinated decisions
 */
public record QuotaDecision(
        boolean granted, double remaining, Duration retryAfter, QuotaSource source, BucketState newState) {

    public static QuotaDecision granted(double remaining, QuotaSource source, BucketState newState) {
        return new QuotaDecision(true, remaining, Duration.ZERO, source, newState);
    }

    public static QuotaDecision denied(
            double remaining, Duration retryAfter, QuotaSource source, BucketState newState) {
        return new QuotaDecision(false, remaining, retryAfter, source, newState);
    }

    /**
     * Returns the remaining tokens rounded down to whole calls.
     *
     * @return remaining whole calls
     */
    public long remainingCalls() {
        return (long) Math.floor(remaining);
    }
}
