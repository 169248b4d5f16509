package tollgate.core.port.out;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.quota.QuotaDecision;
import tollgate.core.model.quota.QuotaPolicy;

/**
 * Port interface for the token bucket guarding the external API's call quota.
 *
 * <p>Implementations keep the bucket in process memory or in a shared store. All
 * operations are non-blocking and return reactive types.
 */
public interface QuotaLimiter {

    /**
     * Refill the bucket for the elapsed time and try to take tokens from it.
     *
     * <p>This is an atomic operation: two concurrent callers can never both observe
     * the same tokens and together overdraw the bucket.
     *
     * @param permits the number of tokens to take
     * @return the decision; a denial leaves the token count unchanged except for refill
     */
    Uni<QuotaDecision> tryConsume(int permits);

    /**
     * Get the tokens currently available without consuming any.
     *
     * @return best-effort token count
     */
    Uni<Double> availableTokens();

    /**
     * Returns the bucket parameters.
     *
     * @return the quota policy
     */
    QuotaPolicy policy();
}
