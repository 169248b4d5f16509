package tollgate.adapter.out.quota.memory;

import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.port.out.QuotaLimiter;
import tollgate.spi.QuotaLimiterProvider;

/**
 * In-memory quota limiter provider.
 *
 * <p>This provider is always available as a fallback. It has the lowest
 * priority (0), so the Redis provider is preferred when available.
 */
public final class InMemoryQuotaLimiterProvider implements QuotaLimiterProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final QuotaPolicy policy;

    public InMemoryQuotaLimiterProvider(QuotaPolicy policy) {
        this.policy = policy;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public QuotaLimiter createQuotaLimiter() {
        return new InMemoryQuotaLimiter(policy);
    }
}
