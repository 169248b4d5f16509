package tollgate.core.model.quota;

import java.time.Duration;

/**
 * Signals that the external API's call quota is exhausted for now.
 *
 * <p>This is an expected, frequent outcome. Callers serve cached data, defer the work,
 * or pass a retry-later signal upward; they must not proceed with the external call.
 */
public class QuotaExceededException extends RuntimeException {

    private final String endpointLabel;
    private final Duration retryAfter;

    public QuotaExceededException(String endpointLabel, Duration retryAfter) {
        super("API quota exhausted for endpoint " + endpointLabel + ", retry after " + retryAfter);
        this.endpointLabel = endpointLabel;
        this.retryAfter = retryAfter;
    }

    /** Returns the label of the endpoint whose call was denied. */
    public String getEndpointLabel() {
        return endpointLabel;
    }

    /** Returns how long until a token is expected to be available. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
