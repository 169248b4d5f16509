package tollgate.core.model.cache;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a tiered cache lookup.
 *
 * @param value the cached payload, if any tier held a fresh entry
 * @param servedBy the tier that served the hit, empty on a miss
 */
public record CacheLookup(Optional<JsonNode> value, Optional<CacheTier> servedBy) {

    private static final CacheLookup MISS = new CacheLookup(Optional.empty(), Optional.empty());

    public static CacheLookup hit(JsonNode value, CacheTier tier) {
        return new CacheLookup(Optional.of(value), Optional.of(tier));
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public boolean isHit() {
        return value.isPresent();
    }
}
