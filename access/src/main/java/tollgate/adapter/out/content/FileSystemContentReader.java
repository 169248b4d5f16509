package tollgate.adapter.out.content;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import tollgate.core.config.TaskStateConfig;
import tollgate.core.port.out.ContentReader;

/**
 * Reads resource content from the local filesystem.
 *
 * <p>Relative addresses are resolved against the configured content root; absolute
 * addresses are used as given. A missing file yields empty without a log entry, any
 * other read failure yields empty with a warning.
 */
@ApplicationScoped
public class FileSystemContentReader implements ContentReader {

    private static final Logger LOG = Logger.getLogger(FileSystemContentReader.class);

    private final Path root;

    @Inject
    public FileSystemContentReader(TaskStateConfig config) {
        this(Path.of(config.contentRoot()));
    }

    public FileSystemContentReader(Path root) {
        this.root = root;
    }

    @Override
    public Uni<Optional<String>> read(String address) {
        return Uni.createFrom()
                .item(() -> readNow(address))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private Optional<String> readNow(String address) {
        final Path file;
        try {
            file = root.resolve(address);
        } catch (InvalidPathException e) {
            LOG.warnv("Invalid content address {0}: {1}", address, e.getMessage());
            return Optional.empty();
        }

        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warnv("Could not read original content at {0}: {1}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
