package tollgate.adapter.out.cache;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import tollgate.core.model.cache.CacheEntry;

/**
 * JSON encoding of cache entries shared by the Redis and disk tiers.
 *
 * <p>An entry is stored as {@code {"key": ..., "value": ..., "writtenAt": "..."}} so the
 * original key can be checked on read and the write time survives the round trip.
 */
public final class CacheEntryCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CacheEntryCodec() {}

    public static String encode(CacheEntry entry) {
        try {
            return OBJECT_MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize cache entry " + entry.key(), e);
        }
    }

    /**
     * Decode a stored entry.
     *
     * @param json the stored JSON
     * @return the entry
     * @throws UncheckedIOException if the JSON is not a valid entry
     */
    public static CacheEntry decode(String json) {
        try {
            final var entry = OBJECT_MAPPER.readValue(json, CacheEntry.class);
            if (entry == null) {
                throw new IOException("Empty cache entry");
            }
            return entry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize cache entry", e);
        }
    }
}
