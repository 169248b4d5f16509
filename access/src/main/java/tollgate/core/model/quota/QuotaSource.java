package tollgate.core.model.quota;

/**
 * Which bucket produced a quota decision.
 */
public enum QuotaSource {
    /** The process-local bucket. */
    LOCAL,
    /** The bucket shared by all processes through the key-value store. */
    COORDINATED
}
