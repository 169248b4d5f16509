package tollgate.core.model.cache;

/**
 * The storage tiers of the response cache, in lookup order.
 */
public enum CacheTier {
    /** Process-local memory. */
    MEMORY,
    /** Shared network key-value store. */
    SHARED,
    /** Local persistent disk. */
    DISK
}
