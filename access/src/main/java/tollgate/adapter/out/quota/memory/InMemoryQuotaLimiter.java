package tollgate.adapter.out.quota.memory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.quota.BucketState;
import tollgate.core.model.quota.QuotaDecision;
import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.model.quota.TokenBucketAlgorithm;
import tollgate.core.port.out.QuotaLimiter;

/**
 * In-memory quota limiter.
 *
 * <p>Holds a single token bucket guarded by a lock, so concurrent callers in this
 * process never overdraw it. The bucket is not shared with other processes: with N
 * processes each metering locally, up to N times the quota can be spent. Use the
 * Redis limiter when several processes share one API credential.
 */
public final class InMemoryQuotaLimiter implements QuotaLimiter {

    private final QuotaPolicy policy;
    private final Clock clock;
    private final TokenBucketAlgorithm algorithm = TokenBucketAlgorithm.getInstance();
    private final ReentrantLock lock = new ReentrantLock();

    private BucketState state;

    public InMemoryQuotaLimiter(QuotaPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public InMemoryQuotaLimiter(QuotaPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
        this.state = BucketState.full(policy.capacity(), clock.millis());
    }

    @Override
    public Uni<QuotaDecision> tryConsume(int permits) {
        return Uni.createFrom().item(() -> consumeNow(permits));
    }

    @Override
    public Uni<Double> availableTokens() {
        return Uni.createFrom().item(this::availableNow);
    }

    @Override
    public QuotaPolicy policy() {
        return policy;
    }

    /**
     * Refill and consume synchronously.
     *
     * @param permits the number of tokens to take
     * @return the decision
     */
    public QuotaDecision consumeNow(int permits) {
        lock.lock();
        try {
            final var decision = algorithm.tryConsume(state, policy, permits, clock.millis());
            state = decision.newState();
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Compute the available tokens synchronously.
     *
     * @return the tokens available now
     */
    public double availableNow() {
        lock.lock();
        try {
            return algorithm.available(state, policy, clock.millis());
        } finally {
            lock.unlock();
        }
    }
}
