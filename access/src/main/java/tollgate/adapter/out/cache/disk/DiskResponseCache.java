package tollgate.adapter.out.cache.disk;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.Executor;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import tollgate.adapter.out.cache.CacheEntryCodec;
import tollgate.core.model.cache.CacheEntry;
import tollgate.core.model.cache.CacheTier;
import tollgate.core.port.out.ResponseCacheTier;

/**
 * Disk tier (L3) of the response cache.
 *
 * <p>Each entry is one JSON file named by the SHA-256 hex digest of its key, so a key
 * maps to its file without an index and arbitrary keys are safe as file names. Writes
 * go to a temporary file that is then moved over the target, so readers never see a
 * partial entry.
 *
 * <p>Expired and unreadable files are deleted when read. {@link #purgeExpired()} sweeps
 * the whole directory. File IO runs on the Mutiny worker pool.
 */
public class DiskResponseCache implements ResponseCacheTier {

    private static final Logger LOG = Logger.getLogger(DiskResponseCache.class);

    static final String FILE_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Duration ttl;
    private final Clock clock;
    private final Executor executor;

    public DiskResponseCache(Path directory, Duration ttl, Clock clock) {
        this(directory, ttl, clock, Infrastructure.getDefaultWorkerPool());
    }

    public DiskResponseCache(Path directory, Duration ttl, Clock clock, Executor executor) {
        this.directory = directory;
        this.ttl = ttl;
        this.clock = clock;
        this.executor = executor;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, e);
        }
        LOG.infov("Disk cache tier at {0} (ttl={1})", directory, ttl);
    }

    @Override
    public CacheTier tier() {
        return CacheTier.DISK;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    /**
     * Returns the directory holding the entry files.
     *
     * @return the cache directory
     */
    public Path directory() {
        return directory;
    }

    @Override
    public Uni<Optional<CacheEntry>> get(String key) {
        return Uni.createFrom().item(() -> read(key)).runSubscriptionOn(executor);
    }

    @Override
    public Uni<Boolean> put(CacheEntry entry) {
        return Uni.createFrom()
                .item(() -> {
                    write(entry);
                    return Boolean.TRUE;
                })
                .runSubscriptionOn(executor);
    }

    @Override
    public Uni<Void> invalidate(String key) {
        return Uni.createFrom()
                .item(() -> {
                    deleteQuietly(fileFor(key));
                    return (Void) null;
                })
                .runSubscriptionOn(executor);
    }

    /**
     * Delete every expired or unreadable entry file.
     *
     * @return the number of files removed
     */
    public Uni<Integer> purgeExpired() {
        return Uni.createFrom().item(this::sweep).runSubscriptionOn(executor);
    }

    Path fileFor(String key) {
        return directory.resolve(hash(key) + FILE_SUFFIX);
    }

    private Optional<CacheEntry> read(String key) {
        final var file = fileFor(key);
        final String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warnv("Failed to read disk cache file {0}: {1}", file, e.getMessage());
            return Optional.empty();
        }

        final CacheEntry entry;
        try {
            entry = CacheEntryCodec.decode(json);
        } catch (UncheckedIOException e) {
            LOG.warnv("Deleting malformed disk cache file {0}: {1}", file, e.getMessage());
            deleteQuietly(file);
            return Optional.empty();
        }

        if (!key.equals(entry.key())) {
            // Digest collision or a foreign file; leave it alone.
            return Optional.empty();
        }
        if (entry.isExpired(ttl, clock.instant())) {
            deleteQuietly(file);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private void write(CacheEntry entry) {
        final var target = fileFor(entry.key());
        try {
            final var temp = Files.createTempFile(directory, hash(entry.key()), TEMP_SUFFIX);
            try {
                Files.writeString(temp, CacheEntryCodec.encode(entry), StandardCharsets.UTF_8);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write disk cache file " + target, e);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private int sweep() {
        final var now = clock.instant();
        var removed = 0;
        try (var files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (final var file : files) {
                if (isExpiredOrMalformed(file, now)) {
                    deleteQuietly(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sweep disk cache directory " + directory, e);
        }
        if (removed > 0) {
            LOG.debugf("Purged %d expired disk cache entries", removed);
        }
        return removed;
    }

    private boolean isExpiredOrMalformed(Path file, Instant now) {
        try {
            return CacheEntryCodec.decode(Files.readString(file, StandardCharsets.UTF_8))
                    .isExpired(ttl, now);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnv("Failed to delete disk cache file {0}: {1}", file, e.getMessage());
        }
    }

    static String hash(String key) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
